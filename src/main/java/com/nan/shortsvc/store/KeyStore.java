package com.nan.shortsvc.store;

/*
  KeyStore hands out short URL-safe keys for strings and resolves them back.
  - create: same value -> same key, different values -> different keys
  - lookup: returns exactly the value that was stored under the key
*/
public interface KeyStore {

    String create(String value);

    String lookup(String key);
}
