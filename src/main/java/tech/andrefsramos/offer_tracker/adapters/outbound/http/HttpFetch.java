package tech.andrefsramos.offer_tracker.adapters.outbound.http;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finalidade

 * GET estático de páginas de ofertas, sem sessão nem cookies.

 * Plano de tentativas
 * - 1ª: User-Agent de navegador (as páginas das operadoras recusam bots declarados);
 * - 2ª: User-Agent identificada do bot, sem espera;
 * - demais (maxRetries): alternando as duas, com espera fixa antes de cada uma e
 *   timeout crescendo 1s por tentativa.
 * O corpo é lido sem limite de tamanho: as listas de pacotes passam dos 2MB padrão do jsoup.
 */
public final class HttpFetch {

    private static final Logger log = LoggerFactory.getLogger(HttpFetch.class);

    static final String UA_BROWSER =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/115.0.0.0 Safari/537.36";

    static final String UA_BOT =
            "OfferTrackerBot/1.0 (+https://andrefsramos.tech/offer-tracker)";

    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String ACCEPT_LANG = "en-US,en;q=0.9,ur;q=0.8";

    private HttpFetch() {}

    /**
     * @return documento parseado, ou {@code null} quando todas as tentativas falharam
     */
    public static Document get(String url, int timeoutMs, int maxRetries, long backoffMs) {
        final long t0 = System.nanoTime();
        List<String> plan = attemptPlan(maxRetries);
        log.info("HttpFetch: GET url={} tentativas={} timeoutMs={} backoffMs={}", url, plan.size(), timeoutMs, backoffMs);

        for (int attempt = 0; attempt < plan.size(); attempt++) {
            // as duas primeiras tentativas (uma por User-Agent) não esperam
            if (attempt >= 2 && !pause(backoffMs)) {
                log.warn("HttpFetch: espera interrompida url={}; abortando.", url);
                return null;
            }
            int timeout = timeoutMs + Math.max(0, attempt - 1) * 1000;
            Document doc = tryOnce(url, plan.get(attempt), timeout);
            if (doc != null) {
                if (attempt > 0) {
                    log.info("HttpFetch: sucesso na tentativa {}/{} url={}", attempt + 1, plan.size(), url);
                }
                return doc;
            }
        }

        log.warn("HttpFetch: falha após {} tentativas url={} elapsedMs={}ms",
                plan.size(), url, (System.nanoTime() - t0) / 1_000_000);
        return null;
    }

    static List<String> attemptPlan(int maxRetries) {
        List<String> plan = new ArrayList<>();
        plan.add(UA_BROWSER);
        plan.add(UA_BOT);
        for (int i = 0; i < Math.max(0, maxRetries); i++) {
            plan.add(i % 2 == 0 ? UA_BROWSER : UA_BOT);
        }
        return plan;
    }

    private static Document tryOnce(String url, String userAgent, int timeoutMs) {
        final long start = System.nanoTime();
        try {
            Document doc = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .maxBodySize(0)
                    .followRedirects(true)
                    .header("Accept", ACCEPT)
                    .header("Accept-Language", ACCEPT_LANG)
                    .header("Cache-Control", "no-cache")
                    .get();
            log.debug("HttpFetch: ok url={} bot={} elapsedMs={}ms", url, UA_BOT.equals(userAgent), (System.nanoTime() - start) / 1_000_000);
            return doc;
        } catch (Exception ex) {
            log.warn("HttpFetch: falha url={} bot={} elapsedMs={}ms msg={}",
                    url, UA_BOT.equals(userAgent), (System.nanoTime() - start) / 1_000_000, ex.getMessage());
            return null;
        }
    }

    private static boolean pause(long ms) {
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
