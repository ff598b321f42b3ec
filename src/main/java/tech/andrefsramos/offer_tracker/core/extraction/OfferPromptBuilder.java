package tech.andrefsramos.offer_tracker.core.extraction;

/*
 * Finalidade

 * Monta o prompt enviado ao serviço de inferência. O texto da página é truncado em
 * maxTextChars para caber na cota do serviço.
 */
public class OfferPromptBuilder {

    private static final String TEMPLATE = """
            You are extracting mobile bundle offers from the visible text of a telecom operator's web page.
            Operator: %s

            Return ONLY a JSON array. Each element must be an object with exactly these string fields:
              "name"     - the offer title as shown on the page
              "price"    - the price digits only (e.g. "250" or "1,500"), or "N/A"
              "validity" - one of "Daily", "Weekly", "Monthly", "3 Days" or "N/A"
              "details"  - data, minutes and SMS allowances joined by ", ", or "N/A"
            Do not add explanations. Do not wrap the array in markdown.
            If there are no offers, return [].

            Page text:
            %s
            """;

    private final int maxTextChars;

    public OfferPromptBuilder(int maxTextChars) {
        this.maxTextChars = Math.max(maxTextChars, 1);
    }

    public String build(String operator, String pageText) {
        String text = pageText == null ? "" : pageText.trim();
        if (text.length() > maxTextChars) {
            text = text.substring(0, maxTextChars);
        }
        return TEMPLATE.formatted(operator, text);
    }
}
