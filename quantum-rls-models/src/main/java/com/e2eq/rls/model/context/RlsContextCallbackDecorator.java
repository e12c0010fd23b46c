package com.e2eq.rls.model.context;

import io.smallrye.mutiny.infrastructure.CallbackDecorator;

import java.util.concurrent.Callable;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Binds Mutiny callbacks to the RLS context that was active when they were assembled.
 *
 * Mutiny passes every user callback (item suppliers, transforms, invocations, failure handlers) through
 * the registered decorators when an operator is created. A callback assembled inside an RLS scope runs
 * inside that same context wherever and whenever Mutiny invokes it: on subscription, after
 * {@code emitOn} or {@code runSubscriptionOn}, or on a thread that carries another context. Callbacks
 * assembled without a context are returned unchanged.
 *
 * Registered through {@code META-INF/services/io.smallrye.mutiny.infrastructure.CallbackDecorator}.
 */
public class RlsContextCallbackDecorator implements CallbackDecorator {

   @Override
   public <T> Supplier<T> decorate(Supplier<T> supplier) {
      RlsContext captured = RlsContextManager.getContextOrNull();
      if (captured == null) {
         return supplier;
      }
      return () -> bound(captured, supplier);
   }

   @Override
   public <T> Consumer<T> decorate(Consumer<T> consumer) {
      RlsContext captured = RlsContextManager.getContextOrNull();
      if (captured == null) {
         return consumer;
      }
      return item -> bound(captured, () -> consumer.accept(item));
   }

   @Override
   public Runnable decorate(Runnable runnable) {
      RlsContext captured = RlsContextManager.getContextOrNull();
      if (captured == null) {
         return runnable;
      }
      return () -> bound(captured, runnable);
   }

   @Override
   public <V> Callable<V> decorate(Callable<V> callable) {
      RlsContext captured = RlsContextManager.getContextOrNull();
      if (captured == null) {
         return callable;
      }
      return () -> {
         if (RlsContextManager.getContextOrNull() == captured) {
            return callable.call();
         }
         return RlsContextManager.call(captured, callable);
      };
   }

   @Override
   public <T1, T2> BiConsumer<T1, T2> decorate(BiConsumer<T1, T2> consumer) {
      RlsContext captured = RlsContextManager.getContextOrNull();
      if (captured == null) {
         return consumer;
      }
      return (a, b) -> bound(captured, () -> consumer.accept(a, b));
   }

   @Override
   public <I, O> Function<I, O> decorate(Function<I, O> function) {
      RlsContext captured = RlsContextManager.getContextOrNull();
      if (captured == null) {
         return function;
      }
      return input -> bound(captured, () -> function.apply(input));
   }

   @Override
   public <I1, I2, O> BiFunction<I1, I2, O> decorate(BiFunction<I1, I2, O> function) {
      RlsContext captured = RlsContextManager.getContextOrNull();
      if (captured == null) {
         return function;
      }
      return (a, b) -> bound(captured, () -> function.apply(a, b));
   }

   // already inside the captured context: no extra scope
   private static <T> T bound(RlsContext ctx, Supplier<T> action) {
      if (RlsContextManager.getContextOrNull() == ctx) {
         return action.get();
      }
      return RlsContextManager.run(ctx, action);
   }

   private static void bound(RlsContext ctx, Runnable action) {
      if (RlsContextManager.getContextOrNull() == ctx) {
         action.run();
         return;
      }
      RlsContextManager.run(ctx, action);
   }
}
