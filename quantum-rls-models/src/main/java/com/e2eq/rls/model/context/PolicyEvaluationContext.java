package com.e2eq.rls.model.context;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Snapshot handed to policy conditions. {@code row} is the existing row for read, update and delete
 * checks; {@code data} is the create or update payload.
 */
@Value
@Builder
public class PolicyEvaluationContext {
   AuthContext auth;
   RequestContext request;
   Map<String, Object> meta;
   String table;
   String operation;
   Map<String, Object> row;
   Map<String, Object> data;

   public static PolicyEvaluationContext from(RlsContext ctx, String table, String operation) {
      return from(ctx, table, operation, null, null);
   }

   public static PolicyEvaluationContext from(RlsContext ctx,
                                              String table,
                                              String operation,
                                              Map<String, Object> row,
                                              Map<String, Object> data) {
      return PolicyEvaluationContext.builder()
         .auth(ctx.getAuth())
         .request(ctx.getRequest())
         .meta(ctx.getMeta())
         .table(table)
         .operation(operation)
         .row(row)
         .data(data)
         .build();
   }

   public Object rowValue(String column) {
      return row == null ? null : row.get(column);
   }

   public Object dataValue(String column) {
      return data == null ? null : data.get(column);
   }

   public Object metaValue(String key) {
      return meta == null ? null : meta.get(key);
   }
}
