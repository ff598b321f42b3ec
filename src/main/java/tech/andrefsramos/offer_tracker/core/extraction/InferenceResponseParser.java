package tech.andrefsramos.offer_tracker.core.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.andrefsramos.offer_tracker.core.domain.ExtractedOffer;
import tech.andrefsramos.offer_tracker.core.domain.FieldClassifier;
import tech.andrefsramos.offer_tracker.core.domain.Validity;
import tech.andrefsramos.offer_tracker.core.ports.InferenceException;

import java.util.ArrayList;
import java.util.List;

/*
 * Finalidade

 * Converte a resposta textual do serviço de inferência em ofertas.

 * Tolerâncias
 *  - remove cercas de código (```json ... ```);
 *  - se o texto não começa com '[', recorta entre o primeiro '[' e o último ']';
 *  - campo ausente, nulo ou vazio em um objeto vira "N/A" (o lote não falha por isso);
 *  - "details" como array é unido com ", ";
 *  - preço reduzido ao token numérico e validade mapeada para os rótulos fixos
 *    (Daily, Weekly, Monthly, 3 Days); validade fora deles vira "N/A".

 * Qualquer payload que, depois do reparo, não seja um array JSON gera InferenceException.
 */
public class InferenceResponseParser {

    private final ObjectMapper objectMapper;

    public InferenceResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ExtractedOffer> parse(String operator, String response) {
        String payload = repair(response);
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new InferenceException("Resposta de inferência não é JSON válido: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new InferenceException("Resposta de inferência não é uma lista JSON");
        }

        List<ExtractedOffer> offers = new ArrayList<>();
        for (JsonNode item : root) {
            if (!item.isObject()) continue;
            offers.add(new ExtractedOffer(
                    operator,
                    field(item, "name"),
                    price(field(item, "price")),
                    validity(field(item, "validity")),
                    field(item, "details")
            ));
        }
        return offers;
    }

    static String repair(String response) {
        if (response == null) {
            throw new InferenceException("Resposta de inferência vazia");
        }
        String cleaned = stripFences(response.trim());
        if (cleaned.startsWith("[")) {
            return cleaned;
        }
        int start = cleaned.indexOf('[');
        int end = cleaned.lastIndexOf(']');
        if (start < 0 || end <= start) {
            throw new InferenceException("Resposta de inferência sem lista JSON");
        }
        return cleaned.substring(start, end + 1);
    }

    private static String stripFences(String s) {
        String cleaned = s;
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    // mesmas regras da extração por padrões
    static String price(String raw) {
        return ExtractedOffer.NOT_AVAILABLE.equals(raw) ? raw : FieldClassifier.priceValue(raw);
    }

    static String validity(String raw) {
        return FieldClassifier.validityHint(raw).map(Validity::label).orElse(ExtractedOffer.NOT_AVAILABLE);
    }

    private static String field(JsonNode item, String name) {
        JsonNode v = item.get(name);
        if (v == null || v.isNull()) return ExtractedOffer.NOT_AVAILABLE;
        if (v.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode p : v) {
                String t = p.asText("").trim();
                if (!t.isEmpty()) parts.add(t);
            }
            return parts.isEmpty() ? ExtractedOffer.NOT_AVAILABLE : String.join(", ", parts);
        }
        String text = v.asText("").trim();
        return text.isEmpty() ? ExtractedOffer.NOT_AVAILABLE : text;
    }
}
