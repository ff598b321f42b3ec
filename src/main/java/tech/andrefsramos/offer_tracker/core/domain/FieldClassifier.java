package tech.andrefsramos.offer_tracker.core.domain;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Finalidade

 * Classifica uma linha de texto de card de oferta. As regras ficam em tabelas
 * ordenadas e a precedência é explícita:
 *  1) preço   - marcador de moeda ("Rs." e "PKR" em início de palavra, "Consumer Price",
 *               "Incl. Tax"); a linha de preço não passa pelas demais regras;
 *  2) detalhe - dados (GB/MB), minutos (Mins) e SMS, cumulativos;
 *  3) validade - palavra-chave; na mesma linha vale a primeira regra da tabela.

 * Todas as comparações são case-insensitive. Linha que não casa com nada é TEXT.
 */
public final class FieldClassifier {

    // "rs." e "pkr" só valem no início de palavra: "Best offers." e "24 hours." não são preço
    private static final Pattern PRICE_MARKER = Pattern.compile(
            "\\brs\\.|\\bpkr|consumer price|incl\\. tax", Pattern.CASE_INSENSITIVE);

    // primeira sequência de dígitos com separadores internos: "1,500.00", "250"
    private static final Pattern PRICE_TOKEN = Pattern.compile("\\d+(?:[.,]\\d+)*");

    private static final List<DetailRule> DETAIL_RULES = List.of(
            new DetailRule(FieldKind.DATA, Pattern.compile("\\d+\\s*(?:GB|MB)", Pattern.CASE_INSENSITIVE)),
            new DetailRule(FieldKind.MINUTES, Pattern.compile("\\d+\\s*Mins", Pattern.CASE_INSENSITIVE)),
            new DetailRule(FieldKind.SMS, Pattern.compile("\\d+\\s*SMS", Pattern.CASE_INSENSITIVE))
    );

    private static final List<ValidityRule> VALIDITY_RULES = List.of(
            new ValidityRule("weekly", Validity.WEEKLY),
            new ValidityRule("monthly", Validity.MONTHLY),
            new ValidityRule("daily", Validity.DAILY),
            new ValidityRule("3 day", Validity.THREE_DAYS)
    );

    private FieldClassifier() {}

    public static LineClassification classify(String line) {
        String l = line == null ? "" : line.trim();
        if (isPrice(l)) {
            return new LineClassification(l, priceValue(l), Set.of(), null);
        }
        return new LineClassification(l, null, detailKinds(l), validityHint(l).orElse(null));
    }

    public static boolean isPrice(String line) {
        return line != null && PRICE_MARKER.matcher(line).find();
    }

    /**
     * Valor normalizado do preço: a primeira sequência numérica da linha, ou a linha
     * inteira quando não há dígitos ("Consumer Price" sozinho, por exemplo).
     */
    public static String priceValue(String line) {
        String l = line == null ? "" : line.trim();
        Matcher m = PRICE_TOKEN.matcher(l);
        return m.find() ? m.group() : l;
    }

    public static Set<FieldKind> detailKinds(String line) {
        EnumSet<FieldKind> kinds = EnumSet.noneOf(FieldKind.class);
        if (line == null) return kinds;
        for (DetailRule rule : DETAIL_RULES) {
            if (rule.pattern().matcher(line).find()) kinds.add(rule.kind());
        }
        return kinds;
    }

    public static Optional<Validity> validityHint(String line) {
        if (line == null) return Optional.empty();
        String lower = line.toLowerCase(Locale.ROOT);
        for (ValidityRule rule : VALIDITY_RULES) {
            if (lower.contains(rule.keyword())) return Optional.of(rule.validity());
        }
        return Optional.empty();
    }

    private record DetailRule(FieldKind kind, Pattern pattern) {}

    private record ValidityRule(String keyword, Validity validity) {}
}
