package com.streamscout.core.search;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 난수 문자열의 MD5 앞 8자리(hex). 호출마다 새로 만든다(캐시 없음).
 * 상태가 없으므로 스레드 세이프.
 */
public final class RandomHashTokenGenerator implements SearchTokenGenerator {

    public static final int LENGTH = 8;

    @Override
    public String next() {
        String seed = Double.toString(ThreadLocalRandom.current().nextDouble());
        return md5Hex(seed).substring(0, LENGTH);
    }

    static String md5Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 모든 JDK가 MD5를 제공해야 한다
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
