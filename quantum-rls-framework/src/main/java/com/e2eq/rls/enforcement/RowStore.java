package com.e2eq.rls.enforcement;

import java.util.Map;
import java.util.Optional;

/**
 * Minimal single table persistence seam wrapped by {@link RlsEnforcer#guard(RowStore)}.
 */
public interface RowStore {
   String getTableName();

   Map<String, Object> create(Map<String, Object> data);

   /**
    * Looks a row up by an exact column match, without RLS filtering.
    */
   Optional<Map<String, Object>> findBy(String column, Object value);

   Map<String, Object> update(Object id, Map<String, Object> data);

   boolean delete(Object id);
}
