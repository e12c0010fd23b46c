package com.e2eq.rls.model.context;

import com.e2eq.rls.exceptions.RlsContextException;
import com.e2eq.rls.exceptions.RlsContextValidationException;
import io.smallrye.mutiny.Uni;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Holds the ambient {@link RlsContext} of the current logical operation.
 *
 * The active context lives in a ThreadLocal together with a per thread stack of the contexts it
 * shadowed, so nested scopes restore exactly what was active before them, even when the nested body
 * throws. Two operations running on different threads never see each other's context. Work that hops
 * threads must carry the context explicitly: use {@link #wrap(Runnable)}, {@link #contextual(Executor)},
 * {@link #supplyAsync(RlsContext, Supplier, Executor)} or {@link #runAsync(RlsContext, Supplier)}. Mutiny
 * callbacks assembled inside a scope keep its context through {@link RlsContextCallbackDecorator}.
 *
 * Outside of any scope {@link #getContextOrNull()} returns null and policies are inactive. Code that
 * touches protected tables is responsible for establishing a context first.
 */
public final class RlsContextManager {
   private static final Logger LOG = Logger.getLogger(RlsContextManager.class);

   private static final ThreadLocal<RlsContext> tlContext = new ThreadLocal<>();
   private static final ThreadLocal<Deque<Optional<RlsContext>>> tlContextStack = ThreadLocal.withInitial(ArrayDeque::new);

   private RlsContextManager() {}

   // --------------------
   // Accessors
   // --------------------

   public static RlsContext getContextOrNull() {
      return tlContext.get();
   }

   public static Optional<RlsContext> findContext() {
      return Optional.ofNullable(tlContext.get());
   }

   /**
    * @throws RlsContextException when no context is active
    */
   public static RlsContext getContext() {
      RlsContext ctx = tlContext.get();
      if (ctx == null) {
         throw new RlsContextException();
      }
      return ctx;
   }

   public static boolean hasContext() {
      return tlContext.get() != null;
   }

   public static AuthContext getAuth() {
      return getContext().getAuth();
   }

   public static String getUserId() {
      return getAuth().getUserId();
   }

   public static String getTenantId() {
      return getAuth().getTenantId();
   }

   public static boolean hasRole(String role) {
      RlsContext ctx = tlContext.get();
      return ctx != null && ctx.getAuth().hasRole(role);
   }

   public static boolean isSystem() {
      RlsContext ctx = tlContext.get();
      return ctx != null && ctx.isSystem();
   }

   /** Depth of shadowed contexts on the current thread. */
   public static int depth() {
      return tlContextStack.get().size();
   }

   // --------------------
   // Scoped execution
   // --------------------

   public static <T> T run(RlsContext ctx, Supplier<T> action) {
      try (Scope ignored = open(ctx)) {
         return action.get();
      }
   }

   public static void run(RlsContext ctx, Runnable action) {
      try (Scope ignored = open(ctx)) {
         action.run();
      }
   }

   public static <T> T call(RlsContext ctx, Callable<T> action) throws Exception {
      try (Scope ignored = open(ctx)) {
         return action.call();
      }
   }

   /**
    * Runs the action as a system context derived from the current one. Requires an active context.
    */
   public static <T> T asSystem(Supplier<T> action) {
      RlsContext current = getContext();
      RlsContext system = current.toBuilder()
         .auth(current.getAuth().asSystem())
         .build();
      return run(system, action);
   }

   /**
    * Installs the context and returns a scope that restores the previous one on close. Supports nesting:
    * try (RlsContextManager.Scope scope = RlsContextManager.open(ctx)) { ... }
    */
   public static Scope open(RlsContext ctx) {
      validate(ctx);
      Deque<Optional<RlsContext>> stack = tlContextStack.get();
      stack.push(Optional.ofNullable(tlContext.get()));
      tlContext.set(ctx);
      if (LOG.isDebugEnabled()) {
         LOG.debugf("===== PUSH RLS Context: %s|%s system=%s (stack depth: %d)",
            ctx.getAuth().getUserId(), ctx.getAuth().getTenantId(), ctx.isSystem(), stack.size());
      }
      return new Scope(ctx, stack.size());
   }

   /** Restores the previous context on close. */
   public static final class Scope implements AutoCloseable {
      private final RlsContext context;
      private final int depth;
      private boolean closed;

      private Scope(RlsContext context, int depth) {
         this.context = context;
         this.depth = depth;
      }

      public RlsContext getContext() {
         return context;
      }

      @Override
      public void close() {
         if (closed) {
            return;
         }
         closed = true;
         Deque<Optional<RlsContext>> stack = tlContextStack.get();
         if (stack.size() != depth) {
            LOG.warnf("RLS context scopes closed out of order: expected depth %d but found %d", depth, stack.size());
         }
         if (stack.isEmpty()) {
            tlContext.remove();
            return;
         }
         Optional<RlsContext> previous = stack.pop();
         if (previous.isPresent()) {
            tlContext.set(previous.get());
         } else {
            tlContext.remove();
         }
         if (stack.isEmpty()) {
            tlContextStack.remove();
         }
         if (LOG.isDebugEnabled()) {
            LOG.debugf("===== POP RLS Context: restored %s (stack depth: %d)",
               previous.map(p -> p.getAuth().getUserId()).orElse("<none>"), stack.size());
         }
      }
   }

   // --------------------
   // Propagation across threads
   // --------------------

   /** Binds the currently active context (if any) to the runnable. */
   public static Runnable wrap(Runnable action) {
      RlsContext captured = tlContext.get();
      return captured == null ? action : wrap(captured, action);
   }

   public static Runnable wrap(RlsContext ctx, Runnable action) {
      Objects.requireNonNull(ctx, "context cannot be null");
      return () -> run(ctx, action);
   }

   public static <T> Supplier<T> wrap(Supplier<T> action) {
      RlsContext captured = tlContext.get();
      return captured == null ? action : wrap(captured, action);
   }

   public static <T> Supplier<T> wrap(RlsContext ctx, Supplier<T> action) {
      Objects.requireNonNull(ctx, "context cannot be null");
      return () -> run(ctx, action);
   }

   public static <T> Callable<T> wrapCallable(Callable<T> action) {
      RlsContext captured = tlContext.get();
      if (captured == null) {
         return action;
      }
      return () -> call(captured, action);
   }

   /**
    * Executor that runs every task with the context that was active on the submitting thread.
    */
   public static Executor contextual(Executor delegate) {
      Objects.requireNonNull(delegate, "executor cannot be null");
      return task -> delegate.execute(wrap(task));
   }

   /** Executor that runs every task with the given context. */
   public static Executor contextual(RlsContext ctx, Executor delegate) {
      Objects.requireNonNull(delegate, "executor cannot be null");
      return task -> delegate.execute(wrap(ctx, task));
   }

   public static <T> CompletableFuture<T> supplyAsync(RlsContext ctx, Supplier<T> action, Executor executor) {
      validate(ctx);
      return CompletableFuture.supplyAsync(wrap(ctx, action), executor);
   }

   /**
    * Assembles the Uni with the context installed, once per subscription. Every callback the action
    * hands to Mutiny (lazy item suppliers, transforms, invocations, failure handlers) is bound to the
    * context by {@link RlsContextCallbackDecorator}, so the context follows the pipeline through
    * {@code emitOn}, {@code runSubscriptionOn} and other thread hops. Stages the caller appends to the
    * returned Uni are outside the scope.
    */
   public static <T> Uni<T> runAsync(RlsContext ctx, Supplier<Uni<T>> action) {
      validate(ctx);
      return Uni.createFrom().deferred(() -> {
         try (Scope ignored = open(ctx)) {
            return action.get();
         }
      });
   }

   // --------------------
   // Factories
   // --------------------

   public static RlsContext createContext(AuthContext auth) {
      return createContext(auth, null, Map.of());
   }

   public static RlsContext createContext(AuthContext auth, RequestContext request, Map<String, Object> meta) {
      RlsContext ctx = RlsContext.builder()
         .auth(auth)
         .request(request)
         .meta(meta == null ? Map.of() : meta)
         .build();
      validate(ctx);
      return ctx;
   }

   public static RlsContext systemContext(String userId, String tenantId) {
      return createContext(AuthContext.builder()
         .userId(userId)
         .tenantId(tenantId)
         .system(true)
         .build());
   }

   static void validate(RlsContext ctx) {
      if (ctx == null) {
         throw new RlsContextValidationException("RLS context can not be null", "context");
      }
      if (ctx.getAuth() == null) {
         throw new RlsContextValidationException("auth can not be null", "auth");
      }
      if (!ctx.getAuth().isSystem() && StringUtils.isBlank(ctx.getAuth().getUserId())) {
         throw new RlsContextValidationException("userId is required unless the context is a system context", "auth.userId");
      }
   }
}
