package tech.andrefsramos.offer_tracker.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Offer Tracker - API de acompanhamento de ofertas de operadoras",
                version = "v1",
                description = """
                                ## Visão Geral

                                Coleta as páginas de pacotes pré-pagos das operadoras, extrai cada oferta
                                (nome, preço, validade, franquias) e registra no ledger se ela é **nova**,
                                **igual** ou **alterada** em relação à última observação.

                                ### Endpoints
                                - `POST /admin/collect/{operator}` coleta uma operadora
                                - `POST /admin/collect` coleta todas as fontes habilitadas
                                - `GET /api/v1/offers` últimas linhas do ledger
                                - `POST /api/v1/offers/preview` testa a extração sobre um texto colado

                                ### Remarks
                                | Remark | Significado |
                                |--------|-------------|
                                | `New Offer` | não há registro anterior para (operadora, nome) |
                                | `Same` | preço e detalhes iguais ao último registro |
                                | `Changed: Price: 250->300` | preço mudou |
                                | `Changed: Details Updated` | franquias mudaram |
                                """
        )
)
public class OpenApiConfig {
}
