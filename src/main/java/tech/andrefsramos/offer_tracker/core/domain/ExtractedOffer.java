package tech.andrefsramos.offer_tracker.core.domain;

/*
 * Finalidade

 * Oferta estruturada produzida por uma estratégia de extração.
 * O operador vem do contexto de quem chama, nunca do texto.
 * Campos ausentes caem nos valores conservadores: "N/A" e "Check Site".
 */
public record ExtractedOffer(
        String operator,
        String name,
        String price,
        String validity,
        String details
) {
    public static final String UNKNOWN_NAME = "Unknown Bundle";
    public static final String NOT_AVAILABLE = "N/A";
    public static final String CHECK_SITE = "Check Site";

    public ExtractedOffer {
        name = blankTo(name, UNKNOWN_NAME);
        price = blankTo(price, NOT_AVAILABLE);
        validity = blankTo(validity, NOT_AVAILABLE);
        details = blankTo(details, CHECK_SITE);
    }

    public boolean isUnknown() {
        return UNKNOWN_NAME.equals(name);
    }

    private static String blankTo(String v, String fallback) {
        return (v == null || v.isBlank()) ? fallback : v.trim();
    }
}
