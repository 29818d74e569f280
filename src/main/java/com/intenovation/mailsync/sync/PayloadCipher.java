package com.intenovation.mailsync.sync;

import javax.mail.MessagingException;

/**
 * Encrypts message content before it reaches the local store. The engine
 * treats the result as opaque text.
 */
public interface PayloadCipher {

    String encrypt(byte[] plaintext) throws MessagingException;

    byte[] decrypt(String ciphertext) throws MessagingException;
}
