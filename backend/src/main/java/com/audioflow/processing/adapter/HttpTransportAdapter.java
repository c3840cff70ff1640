package com.audioflow.processing.adapter;

import com.audioflow.processing.service.FetchOptions;
import com.audioflow.processing.service.ResponseShape;
import com.audioflow.processing.service.TransportAdapter;
import com.audioflow.processing.service.TransportException;
import com.audioflow.processing.service.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * GET over the JDK {@link HttpClient}. The fetch timeout bounds the whole exchange, from connect to
 * the last body byte; the payload limit is enforced while the body streams in.
 */
public class HttpTransportAdapter implements TransportAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpTransportAdapter.class);

    private final HttpClient httpClient;

    public HttpTransportAdapter(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public TransportResponse fetch(String url, FetchOptions options) {
        log.info("HTTP GET {}", url);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(options.timeout())
                    .header(HttpHeaders.ACCEPT, acceptFor(options.responseShape()))
                    .GET()
                    .build();
        } catch (IllegalArgumentException exception) {
            throw new TransportException("GET " + url + " failed: " + exception.getMessage(), exception);
        }

        CompletableFuture<HttpResponse<byte[]>> exchange = httpClient.sendAsync(request, info -> bodyFor(info, options));
        HttpResponse<byte[]> response;
        try {
            response = exchange.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException exception) {
            exchange.cancel(true);
            throw new TransportException("GET " + url + " timed out after " + options.timeout().toMillis() + "ms", exception);
        } catch (InterruptedException exception) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException("GET " + url + " interrupted", exception);
        } catch (ExecutionException exception) {
            Throwable cause = unwrap(exception);
            if (cause instanceof TransportException transportException) {
                throw transportException;
            }
            throw new TransportException("GET " + url + " failed: " + cause.getMessage(), cause);
        }

        if (options.validateStatus() && !isSuccessful(response.statusCode())) {
            throw new TransportException("GET " + url + " returned HTTP " + response.statusCode());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> headers.put(name.toLowerCase(Locale.ROOT), String.join(", ", values)));
        return new TransportResponse(response.statusCode(), headers, response.body());
    }

    private HttpResponse.BodySubscriber<byte[]> bodyFor(HttpResponse.ResponseInfo info, FetchOptions options) {
        if (options.validateStatus() && !isSuccessful(info.statusCode())) {
            return HttpResponse.BodySubscribers.replacing(new byte[0]);
        }
        long declaredLength = info.headers().firstValueAsLong(HttpHeaders.CONTENT_LENGTH).orElse(-1L);
        return new LimitedBodySubscriber(declaredLength, options.maxPayloadBytes());
    }

    private static boolean isSuccessful(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private static Throwable unwrap(ExecutionException exception) {
        Throwable cause = exception.getCause();
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause != null && !(cause instanceof TransportException) && cause.getCause() instanceof TransportException) {
            return cause.getCause();
        }
        return cause == null ? exception : cause;
    }

    private String acceptFor(ResponseShape shape) {
        return switch (shape) {
            case BINARY -> MediaType.ALL_VALUE;
            case JSON -> MediaType.APPLICATION_JSON_VALUE;
            case TEXT -> MediaType.TEXT_PLAIN_VALUE;
        };
    }

    static final class LimitedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {

        private final long declaredLength;
        private final long maxPayloadBytes;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final CompletableFuture<byte[]> body = new CompletableFuture<>();
        private Flow.Subscription subscription;

        LimitedBodySubscriber(long declaredLength, long maxPayloadBytes) {
            this.declaredLength = declaredLength;
            this.maxPayloadBytes = maxPayloadBytes;
        }

        @Override
        public CompletionStage<byte[]> getBody() {
            return body;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            if (declaredLength > maxPayloadBytes) {
                reject("Payload of " + declaredLength + " bytes exceeds limit of " + maxPayloadBytes);
                return;
            }
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            if (body.isDone()) {
                return;
            }
            for (ByteBuffer item : items) {
                if (buffer.size() + (long) item.remaining() > maxPayloadBytes) {
                    reject("Payload exceeds limit of " + maxPayloadBytes + " bytes");
                    return;
                }
                byte[] chunk = new byte[item.remaining()];
                item.get(chunk);
                buffer.write(chunk, 0, chunk.length);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            body.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            body.complete(buffer.toByteArray());
        }

        private void reject(String message) {
            subscription.cancel();
            body.completeExceptionally(new TransportException(message));
        }
    }
}
