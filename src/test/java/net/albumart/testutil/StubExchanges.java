package net.albumart.testutil;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** ExchangeFunction stubs that record requests and answer without a network. */
public final class StubExchanges {

    private StubExchanges() {
    }

    public static ClientResponse response(HttpStatus status, String contentType, String body) {
        ClientResponse.Builder builder = ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, contentType);
        return body == null ? builder.build() : builder.body(body).build();
    }

    /**
     * Records every request and answers with whatever {@code responder} returns for it.
     */
    public static final class Recording implements ExchangeFunction {

        private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
        private final Function<ClientRequest, Mono<ClientResponse>> responder;

        public Recording(Function<ClientRequest, Mono<ClientResponse>> responder) {
            this.responder = responder;
        }

        @Override
        public Mono<ClientResponse> exchange(ClientRequest request) {
            requests.add(request);
            return responder.apply(request);
        }

        public List<ClientRequest> requests() {
            return requests;
        }

        public ClientRequest lastRequest() {
            return requests.get(requests.size() - 1);
        }
    }
}
