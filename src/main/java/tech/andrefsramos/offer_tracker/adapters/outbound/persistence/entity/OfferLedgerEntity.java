package tech.andrefsramos.offer_tracker.adapters.outbound.persistence.entity;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDate;

@Setter
@Getter
@EqualsAndHashCode
@ToString
@Entity
@Table(name = "offer_ledger", indexes = {
        @Index(name = "idx_offer_ledger_key", columnList = "operator_name, offer_name")
})
public class OfferLedgerEntity {

    // identity define a ordem de append: maior id = linha mais recente
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_date", nullable = false)
    private LocalDate runDate;

    @Column(name = "operator_name", nullable = false, length = 100)
    private String operator;

    @Column(name = "offer_name", nullable = false, length = 500)
    private String offerName;

    @Column(length = 50)
    private String validity;

    @Column(length = 1000)
    private String details;

    @Column(length = 200)
    private String price;

    @Column(length = 500)
    private String remark;
}
