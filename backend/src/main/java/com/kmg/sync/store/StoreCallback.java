package com.kmg.sync.store;

import org.springframework.jdbc.core.JdbcTemplate;

@FunctionalInterface
public interface StoreCallback<T> {
    T doInStore(JdbcTemplate jdbc);
}
