package com.tazifor.bidengine.model;

import java.util.Arrays;

/**
 * OpenRTB device type codes.
 */
public enum DeviceType {
    UNKNOWN(0),
    MOBILE(1),
    PERSONAL_COMPUTER(2),
    CONNECTED_TV(3),
    PHONE(4),
    TABLET(5),
    CONNECTED_DEVICE(6),
    SET_TOP_BOX(7);

    private final int code;

    DeviceType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static DeviceType fromCode(Integer code) {
        if (code == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
            .filter(type -> type.code == code)
            .findFirst()
            .orElse(UNKNOWN);
    }
}
