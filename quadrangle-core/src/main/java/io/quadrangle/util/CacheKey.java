package io.quadrangle.util;

import java.util.Objects;

/**
 * Address of a cached invariant: the operation, the field it was computed
 * over (0 when no field is involved) and the content hash of the input.
 */
public final class CacheKey {

   private final String operation;
   private final int fieldOrder;
   private final String contentHash;

   private CacheKey(String operation, int fieldOrder, String contentHash) {
      this.operation = Objects.requireNonNull(operation);
      this.fieldOrder = fieldOrder;
      this.contentHash = Objects.requireNonNull(contentHash);
   }

   public static CacheKey of(String operation, int fieldOrder,
                             String contentHash) {
      return new CacheKey(operation, fieldOrder, contentHash);
   }

   public static CacheKey of(String operation, String contentHash) {
      return new CacheKey(operation, 0, contentHash);
   }

   public String operation() {
      return operation;
   }

   public int fieldOrder() {
      return fieldOrder;
   }

   public String contentHash() {
      return contentHash;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof CacheKey)) return false;
      CacheKey that = (CacheKey) o;
      return fieldOrder == that.fieldOrder &&
              operation.equals(that.operation) &&
              contentHash.equals(that.contentHash);
   }

   @Override
   public int hashCode() {
      return Objects.hash(operation, fieldOrder, contentHash);
   }

   @Override
   public String toString() {
      return operation + "@GF(" + fieldOrder + ")#" + contentHash;
   }
}
