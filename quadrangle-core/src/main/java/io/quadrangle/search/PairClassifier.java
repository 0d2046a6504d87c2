package io.quadrangle.search;

/**
 * Assigns a {@link RelationClass} to every unordered pair of a fixed set of
 * objects {@code 0..size-1}. Implementations must be safe to call from
 * several threads.
 */
public interface PairClassifier {

   int size();

   /**
    * @param a object id, a < b
    * @param b object id
    */
   RelationClass classify(int a, int b);

   String describe();
}
