package com.github.anirbanmu.tether.rest;

// 405
public class MethodNotAllowedException extends HttpException {
    public MethodNotAllowedException(RestResponse response) {
        super(response);
    }
}
