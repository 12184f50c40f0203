package com.github.anirbanmu.tether.gateway;

import java.util.Set;

public final class CloseCodes {
    public static final int NORMAL = 1000;
    public static final int GOING_AWAY = 1001;
    // 1000/1001 invalidate the session on discord's side, anything else keeps it resumable
    public static final int RESUMABLE = 4000;

    public static final int UNKNOWN_ERROR = 4000;
    public static final int UNKNOWN_OPCODE = 4001;
    public static final int DECODE_ERROR = 4002;
    public static final int NOT_AUTHENTICATED = 4003;
    public static final int AUTHENTICATION_FAILED = 4004;
    public static final int ALREADY_AUTHENTICATED = 4005;
    public static final int INVALID_SEQ = 4007;
    public static final int RATE_LIMITED = 4008;
    public static final int SESSION_TIMED_OUT = 4009;
    public static final int INVALID_SHARD = 4010;
    public static final int SHARDING_REQUIRED = 4011;
    public static final int INVALID_API_VERSION = 4012;
    public static final int INVALID_INTENTS = 4013;
    public static final int DISALLOWED_INTENTS = 4014;

    // never sent on the wire: marks a connection we killed locally
    public static final int ZOMBIED = -1;
    public static final int TRANSPORT_ERROR = -2;

    public static final Set<Integer> DEFAULT_NON_RESUMABLE = Set.of(
        AUTHENTICATION_FAILED,
        INVALID_SHARD,
        SHARDING_REQUIRED,
        INVALID_API_VERSION,
        INVALID_INTENTS,
        DISALLOWED_INTENTS);

    private CloseCodes() {
    }
}
