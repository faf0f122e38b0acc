package io.tradehybrid.brokerlink.broker.adapters;

import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Canned-response venue on localhost for adapter tests.
 *
 * Responses are keyed by {@code METHOD path}. A route registered with a query fragment wins over
 * the plain route when the request query contains the fragment. Every request is recorded.
 * Unknown routes answer 404.
 */
class VenueStub implements AutoCloseable {

    record Response(int status, String body) {}

    private record QueryRoute(String key, String fragment, Response response) {}

    record Recorded(String method, String path, String query, String body, Map<String, String> headers) {
        String header(String name) {
            return headers.get(name.toLowerCase());
        }
    }

    private final int port;
    private final Undertow server;
    private final Map<String, Response> routes = new ConcurrentHashMap<>();
    private final List<QueryRoute> queryRoutes = new CopyOnWriteArrayList<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();

    VenueStub(int port) {
        this.port = port;
        this.server = Undertow.builder()
            .addHttpListener(port, "localhost")
            .setHandler(this::handle)
            .build();
        server.start();
    }

    String baseUrl() {
        return "http://localhost:" + port;
    }

    VenueStub on(String method, String path, int status, String body) {
        routes.put(method + " " + path, new Response(status, body));
        return this;
    }

    VenueStub on(String method, String path, String body) {
        return on(method, path, 200, body);
    }

    VenueStub onQuery(String method, String path, String queryFragment, int status, String body) {
        queryRoutes.add(0, new QueryRoute(method + " " + path, queryFragment, new Response(status, body)));
        return this;
    }

    List<Recorded> requests() {
        return List.copyOf(requests);
    }

    List<Recorded> requests(String method, String path) {
        return requests.stream()
            .filter(r -> r.method().equals(method) && r.path().equals(path))
            .toList();
    }

    @Override
    public void close() {
        server.stop();
    }

    private void handle(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            Map<String, String> headers = new ConcurrentHashMap<>();
            ex.getRequestHeaders().forEach(values ->
                headers.put(values.getHeaderName().toString().toLowerCase(), values.getFirst()));
            String method = ex.getRequestMethod().toString();
            String path = ex.getRequestPath();
            requests.add(new Recorded(method, path, ex.getQueryString(), body, headers));

            Response response = route(method + " " + path, ex.getQueryString());
            ex.setStatusCode(response.status());
            ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            ex.getResponseSender().send(response.body());
        });
    }

    private Response route(String key, String query) {
        for (QueryRoute route : queryRoutes) {
            if (route.key().equals(key) && query != null && query.contains(route.fragment())) {
                return route.response();
            }
        }
        return routes.getOrDefault(key, new Response(404, "{\"message\":\"No route for " + key + "\"}"));
    }
}
