package com.github.anirbanmu.tether.rest;

// 400
public class BadRequestException extends HttpException {
    public BadRequestException(RestResponse response) {
        super(response);
    }
}
