package com.github.anirbanmu.tether.rest;

import java.io.IOException;
import java.time.Duration;

// sends one http request. no retries or rate limiting, that all lives in RequestExecutor
@FunctionalInterface
public interface RestTransport {
    RestResponse send(RestRequest request, Duration timeout) throws IOException, InterruptedException;
}
