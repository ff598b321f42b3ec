package tech.andrefsramos.offer_tracker.core.ports;

public interface InferenceClientPort {
    /**
     * Envia o prompt ao serviço de inferência e devolve o texto gerado.
     *
     * @throws RateLimitedException quando o serviço sinaliza limite de taxa
     * @throws InferenceException   em qualquer outra falha
     */
    String generate(String prompt);
}
