package com.github.anirbanmu.tether.rest;

// 404
public class NotFoundException extends HttpException {
    public NotFoundException(RestResponse response) {
        super(response);
    }
}
