package com.taintgrep.maven.fixtures;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class LegacyDigest {

    public static final String SECRET_KEY = "k-91d3aa0c7e";

    public byte[] digest(byte[] data) throws NoSuchAlgorithmException {
        MessageDigest md = MessageDigest.getInstance("MD5");
        return md.digest(data);
    }
}
