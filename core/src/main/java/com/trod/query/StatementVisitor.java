package com.trod.query;

/**
 * Dispatches on the concrete statement type. Drivers implement it to translate statements into
 * their own operations.
 *
 * @param <T> the result type
 */
public interface StatementVisitor<T> {

  T visitSelect(Select<?> select);

  T visitInsert(Insert insert);

  T visitReplace(Replace replace);

  T visitUpdate(Update update);

  T visitDelete(Delete delete);
}
