package com.github.anirbanmu.tether.rest;

// 401
public class UnauthorizedException extends HttpException {
    public UnauthorizedException(RestResponse response) {
        super(response);
    }
}
