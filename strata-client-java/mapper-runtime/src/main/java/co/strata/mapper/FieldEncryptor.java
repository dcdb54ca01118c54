package co.strata.mapper;

import java.util.concurrent.CompletableFuture;

/**
 * Per-field encryption hook. Implementations may complete asynchronously; the mapper waits for
 * each call before moving on to the next field, and a failed future fails the mapping call.
 */
public interface FieldEncryptor {

  CompletableFuture<byte[]> encrypt(byte[] plaintext, FieldEncryptionContext context);

  CompletableFuture<byte[]> decrypt(byte[] ciphertext, FieldEncryptionContext context);
}
