package tech.andrefsramos.offer_tracker.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.offer_tracker.core.application.PreviewExtractionUseCase;
import tech.andrefsramos.offer_tracker.core.application.QueryLedgerUseCase;
import tech.andrefsramos.offer_tracker.core.domain.LedgerRow;

import java.util.List;

/**
 * OffersController
 *
 * Descrição geral:
 * - GET  /api/v1/offers          linhas mais recentes do ledger (filtro opcional por operadora).
 * - POST /api/v1/offers/preview  extrai ofertas de um texto colado e mostra o remark que
 *                                seria gravado, sem gravar.
 */
@RestController
@RequestMapping("/api/v1/offers")
@Tag(name = "02 - Ofertas")
public class OffersController {

    private static final Logger log = LoggerFactory.getLogger(OffersController.class);
    private static final int DEFAULT_SIZE = 50;

    private final QueryLedgerUseCase query;
    private final PreviewExtractionUseCase preview;

    public OffersController(QueryLedgerUseCase query, PreviewExtractionUseCase preview) {
        this.query = query;
        this.preview = preview;
    }

    @GetMapping
    @Operation(summary = "Lista as linhas mais recentes do ledger", description = "Ordenadas da mais recente para a mais antiga (ordem de gravação).")
    public ResponseEntity<List<LedgerRow>> latest(
            @Parameter(description = "Operadora (ex.: Jazz, Zong). Quando omitida, não filtra.", example = "Jazz")
            @RequestParam(required = false) String operator,
            @Parameter(description = "Quantidade de linhas (1..500).", example = "50")
            @RequestParam(defaultValue = "" + DEFAULT_SIZE) int size
    ) {
        long t0 = System.nanoTime();
        if (size <= 0) {
            log.warn("OffersController: parâmetro 'size' inválido (<= 0): {}. Usando {}.", size, DEFAULT_SIZE);
            size = DEFAULT_SIZE;
        }
        try {
            List<LedgerRow> rows = query.latest(operator, size);
            log.info("OffersController: consulta concluída (itens={}, elapsedMs={}) operator='{}'",
                    rows.size(), (System.nanoTime() - t0) / 1_000_000, operator);
            return ResponseEntity.ok(rows);
        } catch (Exception ex) {
            log.error("OffersController: erro ao consultar ledger operator='{}'", operator, ex);
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/preview")
    @Operation(summary = "Pré-visualiza a extração de um texto", description = "Parágrafos separados por linha em branco são tratados como cards.")
    public ResponseEntity<?> preview(@RequestBody PreviewRequest request) {
        if (request == null || request.operator() == null || request.operator().isBlank()) {
            return ResponseEntity.badRequest().body("Field 'operator' is required.");
        }
        if (request.text() == null || request.text().isBlank()) {
            return ResponseEntity.badRequest().body("Field 'text' is required.");
        }
        try {
            List<PreviewResponseItem> items = preview.preview(request.operator(), request.text(), request.strategy())
                    .stream().map(PreviewResponseItem::from).toList();
            return ResponseEntity.ok(items);
        } catch (IllegalArgumentException ex) {
            log.warn("OffersController: pré-visualização rejeitada: {}", ex.getMessage());
            return ResponseEntity.badRequest().body(ex.getMessage());
        } catch (Exception ex) {
            log.error("OffersController: erro na pré-visualização operator='{}'", request.operator(), ex);
            return ResponseEntity.internalServerError().build();
        }
    }
}
