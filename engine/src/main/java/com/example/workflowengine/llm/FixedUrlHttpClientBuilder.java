package com.example.workflowengine.llm;

import dev.langchain4j.http.client.HttpClient;
import dev.langchain4j.http.client.HttpClientBuilder;
import dev.langchain4j.http.client.HttpRequest;
import dev.langchain4j.http.client.SuccessfulHttpResponse;
import dev.langchain4j.http.client.sse.ServerSentEventListener;
import dev.langchain4j.http.client.sse.ServerSentEventParser;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link HttpClientBuilder} whose clients send every request to one fixed URL, whatever path the
 * model client would have appended. Method, headers and body are kept.
 */
class FixedUrlHttpClientBuilder implements HttpClientBuilder {

    private final String url;
    private final HttpClientBuilder delegate;

    FixedUrlHttpClientBuilder(String url, HttpClientBuilder delegate) {
        this.url = Objects.requireNonNull(url, "url");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public Duration connectTimeout() {
        return delegate.connectTimeout();
    }

    @Override
    public HttpClientBuilder connectTimeout(Duration timeout) {
        delegate.connectTimeout(timeout);
        return this;
    }

    @Override
    public Duration readTimeout() {
        return delegate.readTimeout();
    }

    @Override
    public HttpClientBuilder readTimeout(Duration timeout) {
        delegate.readTimeout(timeout);
        return this;
    }

    @Override
    public HttpClient build() {
        return new FixedUrlHttpClient(url, delegate.build());
    }

    private static final class FixedUrlHttpClient implements HttpClient {

        private final String url;
        private final HttpClient delegate;

        private FixedUrlHttpClient(String url, HttpClient delegate) {
            this.url = url;
            this.delegate = delegate;
        }

        @Override
        public SuccessfulHttpResponse execute(HttpRequest request) {
            return delegate.execute(redirect(request));
        }

        @Override
        public void execute(HttpRequest request, ServerSentEventParser parser, ServerSentEventListener listener) {
            delegate.execute(redirect(request), parser, listener);
        }

        private HttpRequest redirect(HttpRequest request) {
            return HttpRequest.builder()
                    .method(request.method())
                    .url(url)
                    .headers(request.headers())
                    .body(request.body())
                    .build();
        }
    }
}
