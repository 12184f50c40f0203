package com.github.anirbanmu.tether.rest;

// 403
public class ForbiddenException extends HttpException {
    public ForbiddenException(RestResponse response) {
        super(response);
    }
}
