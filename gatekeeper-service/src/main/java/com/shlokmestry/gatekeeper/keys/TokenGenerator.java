package com.shlokmestry.gatekeeper.keys;

import java.util.HexFormat;
import java.util.Random;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class TokenGenerator {

    public static final int TOKEN_BYTES = 32;

    private final Random random;

    public TokenGenerator(@Qualifier("tokenRandom") Random random) {
        this.random = random;
    }

    public String next() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
