package io.quadrangle.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * MD5 fingerprint of structural input, used to address cached invariants.
 * Values are fed in a fixed order with explicit lengths, so two different
 * inputs never produce the same byte stream.
 */
public final class ContentHash {

   private static final ThreadLocal<MessageDigest> MD5_DIGEST =
           ThreadLocal.withInitial(() -> {
              try {
                 return MessageDigest.getInstance("MD5");
              } catch (NoSuchAlgorithmException e) {
                 throw new IllegalStateException("MD5 algorithm not available", e);
              }
           });

   private final MessageDigest digest;
   private final byte[] scratch = new byte[4];

   private ContentHash() {
      this.digest = MD5_DIGEST.get();
      this.digest.reset();
   }

   public static ContentHash builder() {
      return new ContentHash();
   }

   public static String md5Hex(String input) {
      return builder().add(input).build();
   }

   public ContentHash add(int value) {
      scratch[0] = (byte) (value >>> 24);
      scratch[1] = (byte) (value >>> 16);
      scratch[2] = (byte) (value >>> 8);
      scratch[3] = (byte) value;
      digest.update(scratch);
      return this;
   }

   public ContentHash add(int[] values) {
      add(values.length);
      for (int v : values) {
         add(v);
      }
      return this;
   }

   public ContentHash add(int[][] rows) {
      add(rows.length);
      for (int[] row : rows) {
         add(row);
      }
      return this;
   }

   public ContentHash add(String value) {
      byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
      add(bytes.length);
      digest.update(bytes);
      return this;
   }

   public String build() {
      return HexFormat.of().formatHex(digest.digest());
   }
}
