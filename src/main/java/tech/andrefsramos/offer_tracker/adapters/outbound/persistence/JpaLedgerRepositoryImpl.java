package tech.andrefsramos.offer_tracker.adapters.outbound.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tech.andrefsramos.offer_tracker.adapters.outbound.persistence.entity.OfferLedgerEntity;
import tech.andrefsramos.offer_tracker.core.domain.HistoricalRecord;
import tech.andrefsramos.offer_tracker.core.domain.LedgerRow;
import tech.andrefsramos.offer_tracker.core.ports.LedgerRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/*
 * JpaLedgerRepositoryImpl

 * Finalidade

 * Implementação JPA do ledger de ofertas (MySQL em produção). O ledger é append-only:
 * este adapter só insere e lê, nunca atualiza nem remove linhas.

 * Modelo de Dados (resumo)

 * - OfferLedgerEntity (tabela `offer_ledger`): uma linha por oferta observada por execução,
 *   com os sete campos (run_date, operator, offer_name, validity, details, price, remark).
 * - O id IDENTITY é a ordem de append e portanto a única noção de recência.
 */
@Repository
public class JpaLedgerRepositoryImpl implements LedgerRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaLedgerRepositoryImpl.class);

    @PersistenceContext
    private EntityManager em;

    @Override
    @Transactional(readOnly = true)
    public List<HistoricalRecord> findAll() {
        long t0 = System.nanoTime();
        List<OfferLedgerEntity> list = em.createQuery(
                "SELECT e FROM OfferLedgerEntity e ORDER BY e.id ASC", OfferLedgerEntity.class).getResultList();

        List<HistoricalRecord> out = new ArrayList<>(list.size());
        for (OfferLedgerEntity e : list) {
            out.add(new HistoricalRecord(e.getRunDate(), e.getOperator(), e.getOfferName(),
                    e.getValidity(), e.getDetails(), e.getPrice()));
        }
        log.debug("[Ledger] findAll linhas={} tookMs={}", out.size(), (System.nanoTime() - t0) / 1_000_000);
        return out;
    }

    @Override
    @Transactional
    public void appendAll(List<LedgerRow> rows) {
        if (rows == null || rows.isEmpty()) {
            log.debug("[Ledger] appendAll chamado sem linhas; nada a gravar.");
            return;
        }
        long t0 = System.nanoTime();
        for (LedgerRow r : rows) {
            if (r.operator() == null || r.name() == null || r.date() == null) {
                throw new IllegalArgumentException("LedgerRow exige date, operator e name: " + r);
            }
            OfferLedgerEntity e = new OfferLedgerEntity();
            e.setRunDate(r.date());
            e.setOperator(r.operator());
            e.setOfferName(r.name());
            e.setValidity(r.validity());
            e.setDetails(r.details());
            e.setPrice(r.price());
            e.setRemark(r.remark());
            em.persist(e);
        }
        em.flush();
        log.info("[Ledger] appendAll concluído. linhas={} tookMs={}", rows.size(), (System.nanoTime() - t0) / 1_000_000);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerRow> findLatest(String operator, int limit) {
        long t0 = System.nanoTime();
        StringBuilder jpql = new StringBuilder("SELECT e FROM OfferLedgerEntity e");
        if (operator != null) {
            jpql.append(" WHERE LOWER(e.operator) = LOWER(:op)");
        }
        jpql.append(" ORDER BY e.id DESC");

        TypedQuery<OfferLedgerEntity> q = em.createQuery(jpql.toString(), OfferLedgerEntity.class);
        if (operator != null) q.setParameter("op", operator);
        q.setMaxResults(Math.max(limit, 1));

        List<LedgerRow> rows = new ArrayList<>();
        for (OfferLedgerEntity e : q.getResultList()) {
            rows.add(toRow(e));
        }
        log.debug("[Ledger] findLatest operator={} limit={} resultados={} tookMs={}",
                operator, limit, rows.size(), (System.nanoTime() - t0) / 1_000_000);
        return Collections.unmodifiableList(rows);
    }

    private static LedgerRow toRow(OfferLedgerEntity e) {
        return new LedgerRow(e.getRunDate(), e.getOperator(), e.getOfferName(), e.getValidity(),
                e.getDetails(), e.getPrice(), e.getRemark());
    }
}
