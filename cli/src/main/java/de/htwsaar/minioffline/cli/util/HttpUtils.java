package de.htwsaar.minioffline.cli.util;

import de.htwsaar.minioffline.cli.dto.HttpCallResult;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

public final class HttpUtils {

    private HttpUtils() {}

    /**
     * Sendet einen Request und liefert Statuscode und Body als String.
     * I/O-Fehler und Unterbrechungen werden als {@link HttpCallResult#ioError(String)} gemeldet.
     */
    public static HttpCallResult sendForStringBody(HttpClient httpClient, HttpRequest request) {
        Objects.requireNonNull(httpClient, "httpClient");
        Objects.requireNonNull(request, "request");

        try {
            HttpResponse<String> resp = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return HttpCallResult.http(resp.statusCode(), resp.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpCallResult.ioError("interrupted");
        } catch (IOException e) {
            return HttpCallResult.ioError(e.getMessage());
        }
    }

    /**
     * Baut einen JSON-POST.
     *
     * @param request vorbereiteter Builder (URI, Timeout)
     * @param json Body
     * @return fertiger Request
     */
    public static HttpRequest jsonPost(HttpRequest.Builder request, String json) {
        return request.header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json == null ? "" : json))
                .build();
    }
}
