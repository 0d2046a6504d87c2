package io.quadrangle.exceptions;

public class IngestException extends KernelException {

   public IngestException(String message) {
      super(message);
   }

   public IngestException(String message, Throwable cause) {
      super(message, cause);
   }
}
