package com.flagship.gift_card_ledger.giftcard;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Generates public gift card codes of the form {@code GC-XXXX-XXXX-XXXX-XXXX}.
 *
 * The alphabet leaves out 0/O and 1/I. Codes are random, so collisions are
 * possible and handled by the caller.
 */
@Component
public class GiftCardCodeGenerator {

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int GROUPS = 4;
    private static final int GROUP_SIZE = 4;
    private static final Pattern FORMAT = Pattern.compile("^GC(-[" + ALPHABET + "]{4}){4}$");

    private final SecureRandom random = new SecureRandom();

    public String nextCode() {
        StringBuilder sb = new StringBuilder("GC");
        for (int g = 0; g < GROUPS; g++) {
            sb.append('-');
            for (int i = 0; i < GROUP_SIZE; i++) {
                sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
            }
        }
        return sb.toString();
    }

    public static boolean isWellFormed(String code) {
        return code != null && FORMAT.matcher(code).matches();
    }
}
