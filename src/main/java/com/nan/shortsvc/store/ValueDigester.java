package com.nan.shortsvc.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

import com.nan.shortsvc.exception.KeyDerivationException;

/*
  Turns a value into the string that candidate keys are cut from:
  MD5 over the UTF-8 bytes, base64 with the URL-safe alphabet and no padding (22 chars).
*/
public class ValueDigester {

    public static final int DIGEST_LENGTH = 22;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    public String digest(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] hash = md.digest(value.getBytes(StandardCharsets.UTF_8));
            return ENCODER.encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new KeyDerivationException("failed to write hash", e);
        }
    }
}
