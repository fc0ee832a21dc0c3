package io.slotsync.core;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.util.Arrays;

public final class Hash implements Comparable<Hash> {

    private final byte[] data;
    private final int hash;

    public Hash(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Input data can not be null");
        }
        this.data = data.clone();
        this.hash = Arrays.hashCode(data);
    }

    public static Hash of(byte[] data) {
        return new Hash(data);
    }

    public static Hash fromHex(String hex) {
        try {
            return new Hash(Hex.decodeHex(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    public int length() {
        return data.length;
    }

    public byte[] getData() {
        return data.clone();
    }

    @Override
    public boolean equals(Object other) {
        return (other instanceof Hash) && Arrays.equals(data, ((Hash) other).data);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public int compareTo(Hash o) {
        return Arrays.compareUnsigned(data, o.data);
    }

    @Override
    public String toString() {
        return Hex.encodeHexString(data);
    }
}
