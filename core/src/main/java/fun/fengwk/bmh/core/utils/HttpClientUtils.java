package fun.fengwk.bmh.core.utils;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Sends requests and folds transport failures into {@link HttpSendResult}.
 *
 * @author fengwk
 */
public final class HttpClientUtils {

    private HttpClientUtils() {
    }

    public static HttpSendResult send(HttpClient httpClient, HttpRequest request) {
        try {
            return HttpSendResult.of(httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream()));
        } catch (IOException ex) {
            return HttpSendResult.failed(ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return HttpSendResult.failed(ex);
        }
    }

    public static CompletableFuture<HttpSendResult> sendAsync(HttpClient httpClient, HttpRequest request) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream())
            .handle((response, error) -> error == null
                ? HttpSendResult.of(response)
                : HttpSendResult.failed(error instanceof CompletionException && error.getCause() != null ? error.getCause() : error));
    }

}
