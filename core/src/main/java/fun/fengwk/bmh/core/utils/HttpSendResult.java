package fun.fengwk.bmh.core.utils;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Response or transport error of one request, the streamed body is released on close.
 *
 * @author fengwk
 */
@Slf4j
public class HttpSendResult implements AutoCloseable {

    private final HttpResponse<InputStream> response;
    private final Throwable error;

    private HttpSendResult(HttpResponse<InputStream> response, Throwable error) {
        this.response = response;
        this.error = error;
    }

    public static HttpSendResult of(HttpResponse<InputStream> response) {
        return new HttpSendResult(response, null);
    }

    public static HttpSendResult failed(Throwable error) {
        return new HttpSendResult(null, error);
    }

    public boolean hasError() {
        return error != null;
    }

    public Throwable getError() {
        return error;
    }

    public int getStatusCode() {
        return response == null ? -1 : response.statusCode();
    }

    public Map<String, List<String>> getHeaders() {
        return response == null ? Map.of() : response.headers().map();
    }

    public String parseBodyString() throws IOException {
        if (response == null || response.body() == null) {
            return "";
        }
        return new String(response.body().readAllBytes(), StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        if (response == null || response.body() == null) {
            return;
        }
        try {
            response.body().close();
        } catch (IOException ex) {
            log.debug("close response body failed, uri={}, error={}", response.uri(), ex.getMessage());
        }
    }

}
