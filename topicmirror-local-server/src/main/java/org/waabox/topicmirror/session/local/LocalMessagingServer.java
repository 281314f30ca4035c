package org.waabox.topicmirror.session.local;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.topicmirror.config.ServerConfig;
import org.waabox.topicmirror.roles.Roles;
import org.waabox.topicmirror.session.HandlerRegistration;
import org.waabox.topicmirror.session.MessagingSession;
import org.waabox.topicmirror.session.MissingTopicHandler;
import org.waabox.topicmirror.session.MissingTopicNotification;
import org.waabox.topicmirror.session.NotificationRegistration;
import org.waabox.topicmirror.session.SessionPropertiesListener;
import org.waabox.topicmirror.session.TopicNotificationListener;
import org.waabox.topicmirror.session.TopicNotificationType;
import org.waabox.topicmirror.session.TopicSelector;
import org.waabox.topicmirror.session.TopicSpecification;
import org.waabox.topicmirror.session.ValueStream;

/**
 * An in-process messaging server.
 *
 * <p>Holds a topic tree in memory and serves any number of
 * {@link MessagingSession sessions} created through {@link #connect}. It
 * implements the subset of server behaviour topicmirror relies on: topic
 * updates and removal, topic notifications, missing-topic requests,
 * subscriptions with value streams, session-properties listeners and
 * client-control subscriptions.
 *
 * <p>Every request is executed, and every callback is delivered, by a
 * single dispatcher thread, so server state never needs locking and
 * callbacks of one source arrive in the order they were produced. Callbacks
 * must not block on futures returned by this server: those futures are
 * completed by the same thread.
 *
 * <p>Removal policies are recorded in the topic specification but are not
 * enforced. There is no authentication: a session is opened for whatever
 * principal is given.
 *
 * <p>Typical usage:
 * <pre>{@code
 * LocalMessagingServer server = new LocalMessagingServer();
 * server.addPrincipal("trader", Set.of("TRADER"));
 * MessagingSession control = server.connect("control");
 * MessagingSession client = server.connect("trader");
 * // ...
 * server.close();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LocalMessagingServer implements AutoCloseable {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      LocalMessagingServer.class);

  /** The single thread that owns all server state. */
  private final ThreadPoolExecutor dispatcher;

  /** Sequence for session identifiers. */
  private final AtomicLong sessionSequence = new AtomicLong();

  /** The topic tree, keyed by path. */
  private final Map<String, Topic> topics = new TreeMap<>();

  /** The open sessions, keyed by session id. */
  private final Map<String, LocalSession> sessions = new LinkedHashMap<>();

  /** The roles of every known principal. */
  private final Map<String, Set<String>> principalRoles = new HashMap<>();

  /** The missing-topic handlers, keyed by branch. */
  private final Map<String, HandlerEntry> missingTopicHandlers =
      new HashMap<>();

  /** The topic notification registrations. */
  private final List<LocalNotificationRegistration> registrations =
      new ArrayList<>();

  /** The session-properties listeners. */
  private final List<PropertiesListenerEntry> propertiesListeners =
      new ArrayList<>();

  /** Creates a new server and starts its dispatcher thread. */
  public LocalMessagingServer() {
    dispatcher = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(), runnable -> {
          final Thread thread = new Thread(runnable,
              "topicmirror-local-dispatcher");
          thread.setDaemon(true);
          return thread;
        });
  }

  /**
   * Declares the roles a principal receives when it connects.
   *
   * @param principal the principal name, never null
   * @param roles     the roles, never null
   */
  public void addPrincipal(final String principal, final Set<String> roles) {
    Objects.requireNonNull(principal, "principal must not be null");
    Objects.requireNonNull(roles, "roles must not be null");
    call(() -> principalRoles.put(principal, new TreeSet<>(roles)));
  }

  /**
   * Opens a session for the principal of a connection descriptor.
   *
   * @param config the connection descriptor, never null
   *
   * @return the open session, never null
   */
  public MessagingSession connect(final ServerConfig config) {
    Objects.requireNonNull(config, "config must not be null");
    return connect(config.principal().orElse(null));
  }

  /**
   * Opens a session.
   *
   * @param principal the principal, null for an anonymous session
   *
   * @return the open session, never null
   */
  public MessagingSession connect(final String principal) {
    return call(() -> openSession(principal));
  }

  /**
   * Returns the current value of a topic.
   *
   * @param path the topic path, never null
   *
   * @return the value, empty if the topic does not exist
   */
  public Optional<JsonNode> value(final String path) {
    Objects.requireNonNull(path, "path must not be null");
    return call(() -> Optional.ofNullable(topics.get(path))
        .map(Topic::copyValue));
  }

  /**
   * Returns the specification of a topic.
   *
   * @param path the topic path, never null
   *
   * @return the specification, empty if the topic does not exist
   */
  public Optional<TopicSpecification> specification(final String path) {
    Objects.requireNonNull(path, "path must not be null");
    return call(() -> Optional.ofNullable(topics.get(path))
        .map(topic -> topic.specification));
  }

  /**
   * Returns the paths of all topics.
   *
   * @return a sorted snapshot of the topic paths, never null
   */
  public Set<String> topicPaths() {
    return call(() -> Collections.unmodifiableSet(
        new TreeSet<>(topics.keySet())));
  }

  /**
   * Returns the number of sessions subscribed to a topic.
   *
   * @param path the topic path, never null
   *
   * @return the subscriber count, zero if the topic does not exist
   */
  public int subscriberCount(final String path) {
    Objects.requireNonNull(path, "path must not be null");
    return call(() -> (int) sessions.values().stream()
        .filter(session -> session.subscriptions.contains(path))
        .count());
  }

  /**
   * Blocks until the dispatcher has no pending work.
   *
   * <p>Must not be called from a callback.
   */
  public void awaitIdle() {
    do {
      CompletableFuture.runAsync(() -> { }, dispatcher).join();
    } while (!dispatcher.getQueue().isEmpty());
  }

  /** Closes every session and stops the dispatcher. */
  @Override
  public void close() {
    if (dispatcher.isShutdown()) {
      return;
    }
    try {
      call(() -> {
        for (final LocalSession session : new ArrayList<>(sessions.values())) {
          closeSession(session, SessionPropertiesListener.CloseReason
              .CLOSED_BY_SERVER);
        }
        return null;
      });
    } finally {
      dispatcher.shutdown();
    }
    log.info("Local messaging server closed");
  }

  /**
   * Runs a task on the dispatcher and waits for its result.
   *
   * @param task the task, never null
   * @param <T>  the result type
   *
   * @return the task result
   */
  private <T> T call(final Supplier<T> task) {
    return submit(task).join();
  }

  /**
   * Runs a task on the dispatcher.
   *
   * @param task the task, never null
   * @param <T>  the result type
   *
   * @return a future with the task result, never null
   */
  private <T> CompletableFuture<T> submit(final Supplier<T> task) {
    try {
      return CompletableFuture.supplyAsync(task, dispatcher);
    } catch (final RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("Server is closed", e));
    }
  }

  /**
   * Queues a task on the dispatcher, dropping it if the server is closed.
   *
   * @param task the task, never null
   */
  private void execute(final Runnable task) {
    try {
      dispatcher.execute(task);
    } catch (final RejectedExecutionException e) {
      log.debug("Dropping task, server is closed");
    }
  }

  /**
   * Invokes an application callback, logging anything it throws.
   *
   * @param what     a description of the callback for logging, never null
   * @param callback the callback, never null
   */
  private static void deliver(final String what, final Runnable callback) {
    try {
      callback.run();
    } catch (final RuntimeException e) {
      log.error("Callback {} threw: {}", what, e.getMessage(), e);
    }
  }

  /**
   * Normalizes a topic path, removing surrounding slashes.
   *
   * @param path the path, never null
   *
   * @return the normalized path, never null
   *
   * @throws IllegalArgumentException if the path is empty
   */
  private static String normalize(final String path) {
    Objects.requireNonNull(path, "path must not be null");
    final String normalized = path.replaceAll("^/+|/+$", "");
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("Empty topic path: '" + path + "'");
    }
    return normalized;
  }

  /**
   * Creates and registers a session. Dispatcher thread only.
   *
   * @param principal the principal, may be null
   *
   * @return the session, never null
   */
  private LocalSession openSession(final String principal) {
    final String id = String.format("%016x-%08x",
        System.identityHashCode(this) & 0xffffffffL,
        sessionSequence.incrementAndGet());
    final Map<String, String> properties = new LinkedHashMap<>();
    properties.put(MessagingSession.SESSION_ID, id);
    properties.put(MessagingSession.PRINCIPAL,
        principal == null ? "" : principal);
    properties.put(MessagingSession.ROLES, Roles.format(
        principalRoles.getOrDefault(principal, Set.of())));

    final LocalSession session = new LocalSession(id,
        Collections.unmodifiableMap(properties));
    sessions.put(id, session);
    log.debug("Opened session {} for principal '{}'", id, principal);

    for (final PropertiesListenerEntry entry
        : new ArrayList<>(propertiesListeners)) {
      if (entry.owner != session) {
        deliver("onSessionOpen", () -> entry.listener.onSessionOpen(id,
            entry.filter(session.properties)));
      }
    }
    return session;
  }

  /**
   * Closes a session and everything it registered. Dispatcher thread only.
   *
   * @param session the session, never null
   * @param reason  the reason reported to listeners, never null
   */
  private void closeSession(final LocalSession session,
      final SessionPropertiesListener.CloseReason reason) {
    if (sessions.remove(session.id) == null) {
      return;
    }

    missingTopicHandlers.entrySet().removeIf(entry -> {
      if (entry.getValue().owner == session) {
        deliver("onClose", () -> entry.getValue().handler.onClose(
            entry.getKey()));
        return true;
      }
      return false;
    });

    for (final LocalNotificationRegistration registration
        : new ArrayList<>(registrations)) {
      if (registration.owner == session) {
        closeRegistration(registration);
      }
    }

    propertiesListeners.removeIf(entry -> {
      if (entry.owner == session) {
        deliver("onClose", entry.listener::onClose);
        return true;
      }
      return false;
    });

    for (final String path : new ArrayList<>(session.subscriptions)) {
      unsubscribe(session, path, ValueStream.UnsubscribeReason.STREAM_CHANGE);
    }
    for (final StreamEntry entry : session.streams) {
      deliver("onClose", entry.stream::onClose);
    }
    session.streams.clear();

    for (final PropertiesListenerEntry entry
        : new ArrayList<>(propertiesListeners)) {
      deliver("onSessionClose", () -> entry.listener.onSessionClose(
          session.id, entry.filter(session.properties), reason));
    }
    log.debug("Closed session {}", session.id);
  }

  /**
   * Creates or updates a topic. Dispatcher thread only.
   *
   * @param path          the normalized path, never null
   * @param value         the value, never null
   * @param specification the specification, never null
   */
  private void setTopic(final String path, final JsonNode value,
      final TopicSpecification specification) {
    final Topic existing = topics.get(path);
    if (existing == null) {
      final Topic topic = new Topic(path, specification, value.deepCopy());
      topics.put(path, topic);
      log.debug("Created topic {}", path);
      notifyRegistrations(topic, TopicNotificationType.ADDED);
      for (final LocalSession session : new ArrayList<>(sessions.values())) {
        if (session.selects(path)) {
          subscribe(session, topic);
        }
      }
      return;
    }

    if (existing.specification.type() != specification.type()) {
      throw new IllegalStateException("Topic " + path + " is of type "
          + existing.specification.type() + ", cannot set a "
          + specification.type() + " value");
    }
    final JsonNode oldValue = existing.value;
    existing.value = value.deepCopy();
    for (final LocalSession session : new ArrayList<>(sessions.values())) {
      if (session.subscriptions.contains(path)) {
        for (final StreamEntry entry : session.streamsFor(path)) {
          deliver("onValue", () -> entry.stream.onValue(path,
              existing.specification, oldValue.deepCopy(),
              existing.copyValue()));
        }
      }
    }
  }

  /**
   * Removes the topics matching a selector. Dispatcher thread only.
   *
   * @param selector the selector, never null
   *
   * @return the number of removed topics
   */
  private int removeTopics(final TopicSelector selector) {
    final List<Topic> removed = new ArrayList<>();
    for (final Topic topic : topics.values()) {
      if (selector.matches(topic.path)) {
        removed.add(topic);
      }
    }
    for (final Topic topic : removed) {
      for (final LocalSession session : new ArrayList<>(sessions.values())) {
        unsubscribe(session, topic.path,
            ValueStream.UnsubscribeReason.REMOVAL);
      }
      topics.remove(topic.path);
      notifyRegistrations(topic, TopicNotificationType.REMOVED);
      log.debug("Removed topic {}", topic.path);
    }
    return removed.size();
  }

  /**
   * Records a selection and subscribes the session to matching topics,
   * raising a missing-topic request when nothing matches. Dispatcher
   * thread only.
   *
   * @param session  the selecting session, never null
   * @param selector the selector, never null
   * @param result   completed when the selection is applied, never null
   */
  private void select(final LocalSession session,
      final TopicSelector selector, final CompletableFuture<Void> result) {
    session.selections.add(selector);

    boolean matched = false;
    for (final Topic topic : new ArrayList<>(topics.values())) {
      if (selector.matches(topic.path)) {
        matched = true;
        subscribe(session, topic);
      }
    }
    if (matched) {
      result.complete(null);
      return;
    }

    final String path = selector.pathPrefix();
    final Map.Entry<String, HandlerEntry> handler = findHandler(path);
    if (handler == null) {
      result.complete(null);
      return;
    }

    final LocalMissingTopicNotification notification =
        new LocalMissingTopicNotification(path, selector.expression(),
            session.id, result);
    deliver("onMissingTopic",
        () -> handler.getValue().handler.onMissingTopic(notification));
  }

  /**
   * Finds the handler registered for the longest branch containing a path.
   *
   * @param path the path, never null
   *
   * @return the branch and its handler, null if none applies
   */
  private Map.Entry<String, HandlerEntry> findHandler(final String path) {
    Map.Entry<String, HandlerEntry> best = null;
    if (path.isEmpty()) {
      return null;
    }
    for (final Map.Entry<String, HandlerEntry> entry
        : missingTopicHandlers.entrySet()) {
      final String branch = entry.getKey();
      final boolean contains = path.equals(branch)
          || path.startsWith(branch + "/");
      if (contains && (best == null
          || branch.length() > best.getKey().length())) {
        best = entry;
      }
    }
    return best;
  }

  /**
   * Subscribes a session to a topic, feeding its matching streams.
   *
   * @param session the session, never null
   * @param topic   the topic, never null
   */
  private void subscribe(final LocalSession session, final Topic topic) {
    if (!session.subscriptions.add(topic.path)) {
      return;
    }
    for (final StreamEntry entry : session.streamsFor(topic.path)) {
      deliver("onSubscription", () -> entry.stream.onSubscription(
          topic.path, topic.specification));
      deliver("onValue", () -> entry.stream.onValue(topic.path,
          topic.specification, null, topic.copyValue()));
    }
  }

  /**
   * Unsubscribes a session from a topic, if it is subscribed.
   *
   * @param session the session, never null
   * @param path    the topic path, never null
   * @param reason  the reason reported to streams, never null
   */
  private void unsubscribe(final LocalSession session, final String path,
      final ValueStream.UnsubscribeReason reason) {
    if (!session.subscriptions.remove(path)) {
      return;
    }
    final Topic topic = topics.get(path);
    final TopicSpecification specification = topic != null
        ? topic.specification : null;
    for (final StreamEntry entry : session.streamsFor(path)) {
      deliver("onUnsubscription", () -> entry.stream.onUnsubscription(path,
          specification, reason));
    }
  }

  /**
   * Notifies every registration selecting a topic.
   *
   * @param topic the topic, never null
   * @param type  the notification type, never null
   */
  private void notifyRegistrations(final Topic topic,
      final TopicNotificationType type) {
    for (final LocalNotificationRegistration registration
        : new ArrayList<>(registrations)) {
      if (registration.selects(topic.path)) {
        deliver("onTopicNotification",
            () -> registration.listener.onTopicNotification(topic.path,
                topic.specification, type));
      }
    }
  }

  /**
   * Removes a registration and closes its listener.
   *
   * @param registration the registration, never null
   */
  private void closeRegistration(
      final LocalNotificationRegistration registration) {
    if (registrations.remove(registration)) {
      deliver("onClose", registration.listener::onClose);
    }
  }

  /** A topic in the tree. */
  private static final class Topic {

    /** The topic path. */
    private final String path;

    /** The topic specification. */
    private final TopicSpecification specification;

    /** The current value. */
    private JsonNode value;

    /**
     * Creates a topic.
     *
     * @param thePath          the path
     * @param theSpecification the specification
     * @param theValue         the initial value
     */
    private Topic(final String thePath,
        final TopicSpecification theSpecification, final JsonNode theValue) {
      path = thePath;
      specification = theSpecification;
      value = theValue;
    }

    /**
     * Returns a copy of the current value.
     *
     * @return the copy, never null
     */
    private JsonNode copyValue() {
      return value.deepCopy();
    }
  }

  /** A registered missing-topic handler. */
  private final class HandlerEntry implements HandlerRegistration {

    /** The session that registered the handler. */
    private final LocalSession owner;

    /** The branch the handler serves. */
    private final String branch;

    /** The handler. */
    private final MissingTopicHandler handler;

    /**
     * Creates a registration.
     *
     * @param theOwner   the owning session
     * @param theBranch  the normalized branch
     * @param theHandler the handler
     */
    private HandlerEntry(final LocalSession theOwner, final String theBranch,
        final MissingTopicHandler theHandler) {
      owner = theOwner;
      branch = theBranch;
      handler = theHandler;
    }

    @Override
    public String branch() {
      return branch;
    }

    @Override
    public CompletableFuture<Void> close() {
      return submit(() -> {
        // The branch may already belong to a newer handler.
        if (missingTopicHandlers.remove(branch, this)) {
          deliver("onClose", () -> handler.onClose(branch));
        }
        return null;
      });
    }
  }

  /**
   * A value stream added to a session.
   *
   * @param selector the stream selector
   * @param stream   the stream
   */
  private record StreamEntry(TopicSelector selector, ValueStream stream) {
  }

  /** A registered session-properties listener. */
  private static final class PropertiesListenerEntry {

    /** The session that registered the listener. */
    private final LocalSession owner;

    /** The property keys the listener receives. */
    private final Set<String> keys;

    /** The listener. */
    private final SessionPropertiesListener listener;

    /**
     * Creates an entry.
     *
     * @param theOwner    the owning session
     * @param theKeys     the requested keys
     * @param theListener the listener
     */
    private PropertiesListenerEntry(final LocalSession theOwner,
        final Set<String> theKeys,
        final SessionPropertiesListener theListener) {
      owner = theOwner;
      keys = Set.copyOf(theKeys);
      listener = theListener;
    }

    /**
     * Keeps only the properties this listener asked for.
     *
     * @param properties the session properties, never null
     *
     * @return the filtered properties, never null
     */
    private Map<String, String> filter(final Map<String, String> properties) {
      final Map<String, String> filtered = new LinkedHashMap<>();
      properties.forEach((key, value) -> {
        if (keys.contains(key)) {
          filtered.put(key, value);
        }
      });
      return Collections.unmodifiableMap(filtered);
    }
  }

  /** A missing-topic request waiting for its handler. */
  private final class LocalMissingTopicNotification
      implements MissingTopicNotification {

    /** The missing path. */
    private final String path;

    /** The selector expression. */
    private final String selector;

    /** The requesting session id. */
    private final String sessionId;

    /** The pending selection. */
    private final CompletableFuture<Void> selection;

    /**
     * Creates a request.
     *
     * @param thePath      the missing path
     * @param theSelector  the selector expression
     * @param theSessionId the requesting session id
     * @param theSelection the pending selection
     */
    private LocalMissingTopicNotification(final String thePath,
        final String theSelector, final String theSessionId,
        final CompletableFuture<Void> theSelection) {
      path = thePath;
      selector = theSelector;
      sessionId = theSessionId;
      selection = theSelection;
    }

    @Override
    public String path() {
      return path;
    }

    @Override
    public String selector() {
      return selector;
    }

    @Override
    public String sessionId() {
      return sessionId;
    }

    @Override
    public void proceed() {
      execute(() -> selection.complete(null));
    }

    @Override
    public void cancel() {
      execute(() -> selection.completeExceptionally(
          new IllegalStateException("Missing topic request for " + path
              + " was cancelled")));
    }
  }

  /** A topic notification registration. */
  private final class LocalNotificationRegistration
      implements NotificationRegistration {

    /** The owning session. */
    private final LocalSession owner;

    /** The listener. */
    private final TopicNotificationListener listener;

    /** The registered selectors. */
    private final List<TopicSelector> selectors = new ArrayList<>();

    /**
     * Creates a registration.
     *
     * @param theOwner    the owning session
     * @param theListener the listener
     */
    private LocalNotificationRegistration(final LocalSession theOwner,
        final TopicNotificationListener theListener) {
      owner = theOwner;
      listener = theListener;
    }

    /**
     * Checks whether any registered selector selects a path.
     *
     * @param path the topic path, never null
     *
     * @return true if selected
     */
    private boolean selects(final String path) {
      for (final TopicSelector selector : selectors) {
        if (selector.matches(path)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public CompletableFuture<Void> select(final String selector) {
      final TopicSelector parsed = TopicSelector.parse(selector);
      return submit(() -> {
        if (!registrations.contains(this)) {
          throw new IllegalStateException("Registration is closed");
        }
        final List<Topic> newlySelected = new ArrayList<>();
        for (final Topic topic : topics.values()) {
          if (parsed.matches(topic.path) && !selects(topic.path)) {
            newlySelected.add(topic);
          }
        }
        selectors.add(parsed);
        for (final Topic topic : newlySelected) {
          deliver("onTopicNotification", () -> listener.onTopicNotification(
              topic.path, topic.specification,
              TopicNotificationType.SELECTED));
        }
        return null;
      });
    }

    @Override
    public CompletableFuture<Void> deselect(final String selector) {
      final TopicSelector parsed = TopicSelector.parse(selector);
      return submit(() -> {
        final List<Topic> previouslySelected = new ArrayList<>();
        for (final Topic topic : topics.values()) {
          if (selects(topic.path)) {
            previouslySelected.add(topic);
          }
        }
        selectors.remove(parsed);
        for (final Topic topic : previouslySelected) {
          if (!selects(topic.path)) {
            deliver("onTopicNotification",
                () -> listener.onTopicNotification(topic.path,
                    topic.specification, TopicNotificationType.DESELECTED));
          }
        }
        return null;
      });
    }

    @Override
    public CompletableFuture<Void> close() {
      return submit(() -> {
        closeRegistration(this);
        return null;
      });
    }
  }

  /** A session connected to this server. */
  private final class LocalSession implements MessagingSession {

    /** The session id. */
    private final String id;

    /** The fixed session properties. */
    private final Map<String, String> properties;

    /** The selections of this session. */
    private final List<TopicSelector> selections = new ArrayList<>();

    /** The subscribed topic paths. */
    private final Set<String> subscriptions = new TreeSet<>();

    /** The value streams of this session. */
    private final List<StreamEntry> streams = new ArrayList<>();

    /**
     * Creates a session.
     *
     * @param theId         the session id
     * @param theProperties the fixed properties
     */
    private LocalSession(final String theId,
        final Map<String, String> theProperties) {
      id = theId;
      properties = theProperties;
    }

    /**
     * Checks whether any selection of this session selects a path.
     *
     * @param path the topic path, never null
     *
     * @return true if selected
     */
    private boolean selects(final String path) {
      for (final TopicSelector selector : selections) {
        if (selector.matches(path)) {
          return true;
        }
      }
      return false;
    }

    /**
     * Returns the streams whose selector matches a path.
     *
     * @param path the topic path, never null
     *
     * @return the matching streams, never null
     */
    private List<StreamEntry> streamsFor(final String path) {
      final List<StreamEntry> matching = new ArrayList<>();
      for (final StreamEntry entry : streams) {
        if (entry.selector().matches(path)) {
          matching.add(entry);
        }
      }
      return matching;
    }

    /** Fails if this session has been closed. */
    private void requireOpen() {
      if (!sessions.containsKey(id)) {
        throw new IllegalStateException("Session " + id + " is closed");
      }
    }

    @Override
    public String sessionId() {
      return id;
    }

    @Override
    public Map<String, String> properties() {
      return properties;
    }

    @Override
    public CompletableFuture<Void> set(final String path,
        final JsonNode value, final TopicSpecification specification) {
      Objects.requireNonNull(value, "value must not be null");
      Objects.requireNonNull(specification,
          "specification must not be null");
      final String normalized = normalize(path);
      return submit(() -> {
        requireOpen();
        setTopic(normalized, value, specification);
        return null;
      });
    }

    @Override
    public CompletableFuture<Integer> remove(final String selector) {
      final TopicSelector parsed = TopicSelector.parse(selector);
      return submit(() -> {
        requireOpen();
        return removeTopics(parsed);
      });
    }

    @Override
    public CompletableFuture<NotificationRegistration> addNotificationListener(
        final TopicNotificationListener listener) {
      Objects.requireNonNull(listener, "listener must not be null");
      return submit(() -> {
        requireOpen();
        final LocalNotificationRegistration registration =
            new LocalNotificationRegistration(this, listener);
        registrations.add(registration);
        return registration;
      });
    }

    @Override
    public CompletableFuture<HandlerRegistration> addMissingTopicHandler(
        final String branch, final MissingTopicHandler handler) {
      Objects.requireNonNull(handler, "handler must not be null");
      final String normalized = normalize(branch);
      return submit(() -> {
        requireOpen();
        if (missingTopicHandlers.containsKey(normalized)) {
          throw new IllegalStateException(
              "A missing topic handler is already registered for "
                  + normalized);
        }
        final HandlerEntry entry = new HandlerEntry(this, normalized, handler);
        missingTopicHandlers.put(normalized, entry);
        deliver("onRegister", () -> handler.onRegister(normalized));
        return entry;
      });
    }

    @Override
    public CompletableFuture<Void> setSessionPropertiesListener(
        final Set<String> propertyKeys,
        final SessionPropertiesListener listener) {
      Objects.requireNonNull(propertyKeys, "propertyKeys must not be null");
      Objects.requireNonNull(listener, "listener must not be null");
      return submit(() -> {
        requireOpen();
        final PropertiesListenerEntry entry =
            new PropertiesListenerEntry(this, propertyKeys, listener);
        propertiesListeners.add(entry);
        deliver("onActive", listener::onActive);
        for (final LocalSession session : new ArrayList<>(sessions.values())) {
          if (session != this) {
            deliver("onSessionOpen", () -> listener.onSessionOpen(
                session.id, entry.filter(session.properties)));
          }
        }
        return null;
      });
    }

    @Override
    public CompletableFuture<Void> subscribe(final String sessionId,
        final String selector) {
      Objects.requireNonNull(sessionId, "sessionId must not be null");
      final TopicSelector parsed = TopicSelector.parse(selector);
      final CompletableFuture<Void> result = new CompletableFuture<>();
      execute(() -> {
        try {
          requireOpen();
          final LocalSession target = sessions.get(sessionId);
          if (target == null) {
            throw new IllegalArgumentException(
                "Unknown session: " + sessionId);
          }
          LocalMessagingServer.this.select(target, parsed, result);
        } catch (final RuntimeException e) {
          result.completeExceptionally(e);
        }
      });
      return result;
    }

    @Override
    public void addStream(final String selector, final ValueStream stream) {
      Objects.requireNonNull(stream, "stream must not be null");
      final TopicSelector parsed = TopicSelector.parse(selector);
      execute(() -> {
        final StreamEntry entry = new StreamEntry(parsed, stream);
        streams.add(entry);
        for (final String path : subscriptions) {
          final Topic topic = topics.get(path);
          if (topic != null && parsed.matches(path)) {
            deliver("onSubscription", () -> stream.onSubscription(path,
                topic.specification));
            deliver("onValue", () -> stream.onValue(path,
                topic.specification, null, topic.copyValue()));
          }
        }
      });
    }

    @Override
    public CompletableFuture<Void> select(final String selector) {
      final TopicSelector parsed = TopicSelector.parse(selector);
      final CompletableFuture<Void> result = new CompletableFuture<>();
      execute(() -> {
        try {
          requireOpen();
          LocalMessagingServer.this.select(this, parsed, result);
        } catch (final RuntimeException e) {
          result.completeExceptionally(e);
        }
      });
      return result;
    }

    @Override
    public CompletableFuture<Void> unselect(final String selector) {
      final TopicSelector parsed = TopicSelector.parse(selector);
      return submit(() -> {
        requireOpen();
        selections.remove(parsed);
        for (final String path : new ArrayList<>(subscriptions)) {
          if (!selects(path)) {
            unsubscribe(this, path, ValueStream.UnsubscribeReason.REQUESTED);
          }
        }
        return null;
      });
    }

    @Override
    public void close() {
      execute(() -> closeSession(this,
          SessionPropertiesListener.CloseReason.CLOSED_BY_CLIENT));
    }
  }
}
