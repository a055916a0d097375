package com.ryuqq.guardmap.core.exception;

/**
 * {@code at(key)} 조회 시 키가 존재하지 않는 경우.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public class KeyNotFoundException extends GuardMapException {

    private final transient Object key;

    public KeyNotFoundException(Object key, ContainerStateSnapshot snapshot) {
        super("key not found: " + key, null, snapshot);
        this.key = key;
    }

    public Object key() {
        return key;
    }
}
