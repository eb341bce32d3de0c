package com.parkalot.parking.domain;

/**
 * Enum persisted and serialized by its lowercase storage code rather than its name.
 */
public interface CodedEnum {

    String getCode();

    static <E extends Enum<E> & CodedEnum> E fromCode(Class<E> type, String code) {
        if (code == null) {
            return null;
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.getCode().equalsIgnoreCase(code.trim())) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + code);
    }
}
