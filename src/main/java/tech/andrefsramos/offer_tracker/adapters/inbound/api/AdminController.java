package tech.andrefsramos.offer_tracker.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.offer_tracker.core.application.CollectOffersUseCase;
import tech.andrefsramos.offer_tracker.core.domain.CollectReport;

/**
 * AdminController
 *
 * Descrição geral:
 * - Permite acionar manualmente a coleta de ofertas de uma operadora ou de todas as fontes habilitadas.
 * - Devolve o {@link CollectReport} da execução.
 */
@RestController
@RequestMapping("/admin")
@Tag(name = "01 - Administração")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);
    private final CollectOffersUseCase collect;

    public AdminController(CollectOffersUseCase collect) {this.collect = collect;}

    @PostMapping("/collect/{operator}")
    @Operation(summary = "Coleta ofertas de uma operadora", description = "Executa extração, compara com o ledger e grava as linhas do dia.")
    public ResponseEntity<?> collect(@PathVariable String operator) {
        log.info("AdminController: solicitação de coleta recebida para operator='{}'", operator);

        if (operator == null || operator.isBlank()) {
            log.warn("AdminController: parâmetro 'operator' inválido ou vazio");
            return ResponseEntity.badRequest().body("Operator parameter cannot be empty.");
        }

        try {
            CollectReport report = collect.collectForOperator(operator);
            log.info("AdminController: coleta concluída para operator='{}' report={}", operator, report);
            return ResponseEntity.ok(report);
        } catch (Exception ex) {
            log.error("AdminController: erro ao executar coleta para operator='{}'", operator, ex);
            return ResponseEntity.internalServerError()
                    .body("Error during collect for operator '" + operator + "': " + ex.getMessage());
        }
    }

    @PostMapping("/collect")
    @Operation(summary = "Coleta ofertas de todas as fontes habilitadas")
    public ResponseEntity<?> collectAll() {
        log.info("AdminController: solicitação de coleta completa recebida");
        try {
            CollectReport report = collect.collectAllEnabled();
            return ResponseEntity.ok(report);
        } catch (Exception ex) {
            log.error("AdminController: erro na coleta completa", ex);
            return ResponseEntity.internalServerError().body("Error during collect: " + ex.getMessage());
        }
    }
}
