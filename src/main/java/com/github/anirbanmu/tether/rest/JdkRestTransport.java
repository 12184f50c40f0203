package com.github.anirbanmu.tether.rest;

import com.github.anirbanmu.tether.util.Http;
import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

public class JdkRestTransport implements RestTransport {

    @Override
    public RestResponse send(RestRequest request, Duration timeout) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(request.uri())
            .timeout(timeout);
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        HttpRequest.BodyPublisher publisher = request.body() == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(request.body());
        builder.method(request.method(), publisher);

        HttpResponse<byte[]> response = Http.CLIENT.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        return new RestResponse(response.statusCode(), response.headers().map(), response.body());
    }
}
