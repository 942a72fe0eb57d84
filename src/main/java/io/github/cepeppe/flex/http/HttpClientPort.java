package io.github.cepeppe.flex.http;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Porta applicativa per l'invio di richieste HTTP sincrone con retry e backoff esponenziale.
 * Il client Flex dipende solo da questa interfaccia (nei test è sostituita da un mock).
 * <p>
 * Il corpo resta in byte: i documenti XML dichiarano la propria codifica nel prolog.
 */
public interface HttpClientPort {

    /**
     * Invia una richiesta HTTP in modo sincrono applicando retry con backoff esponenziale
     * su status ritentabili ed eccezioni di I/O.
     *
     * @param req la {@link HttpRequest} da inviare.
     * @return la prima risposta non ritentabile, o l'ultima ottenuta se i tentativi si esauriscono (corpo grezzo).
     * @throws IOException          se nessun tentativo ha prodotto una risposta
     * @throws InterruptedException se l'attesa tra i retry viene interrotta
     */
    HttpResponse<byte[]> sendWithRetry(HttpRequest req) throws IOException, InterruptedException;
}
