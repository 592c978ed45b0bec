package com.flagship.split_ledger.group;

import lombok.Value;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Opaque identity key of a party: a {@code 0x}-prefixed, 40 hex digit address.
 *
 * Addresses are normalized to lower case, so two spellings of the same address are the
 * same member. Display metadata lives elsewhere.
 */
@Value
public class Member {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    String address;

    private Member(String address) {
        this.address = address;
    }

    public static Member of(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Member address is required");
        }
        String normalized = address.trim().toLowerCase(Locale.ROOT);
        if (!ADDRESS.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Not a valid member address: " + address);
        }
        return new Member(normalized);
    }

    @Override
    public String toString() {
        return address;
    }
}
