package com.github.anirbanmu.tether.config;

import com.github.anirbanmu.tether.TetherException;

public class ConfigException extends TetherException {
    public ConfigException(String message) {
        super(message);
    }
}
