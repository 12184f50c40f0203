package com.github.anirbanmu.tether.rest;

// any 5xx, including 500/502/504 once their retries are spent
public class ServerErrorException extends HttpException {
    public ServerErrorException(RestResponse response) {
        super(response);
    }
}
