package ca.gc.cra.tracker.domain.scene;

import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Non-owning handle to the on-screen context (window, scene, view) an event belongs to.
 *
 * <p>The UI object is held through a {@link WeakReference}; holding a {@code SceneRef} never keeps the
 * host's UI alive. The {@link #sceneId()} survives collection of the referent so routing can still
 * be keyed after the UI object is gone.</p>
 * <p><strong>Thread-safety:</strong> Immutable apart from the referent being cleared by the GC.</p>
 *
 * @since 0.1.0
 */
public final class SceneRef {
  private final String sceneId;
  private final WeakReference<Object> target;

  private SceneRef(String sceneId, Object target) {
    this.sceneId = sceneId;
    this.target = new WeakReference<>(target);
  }

  /**
   * Creates a handle for the supplied UI object with a generated identifier.
   *
   * @param target host UI object; never {@code null}
   * @return scene handle
   */
  public static SceneRef of(Object target) {
    return of(UUID.randomUUID().toString(), target);
  }

  /**
   * Creates a handle for the supplied UI object using a host-provided identifier.
   *
   * @param sceneId stable scene identifier; never {@code null}
   * @param target host UI object; never {@code null}
   * @return scene handle
   */
  public static SceneRef of(String sceneId, Object target) {
    return new SceneRef(Objects.requireNonNull(sceneId, "sceneId"), Objects.requireNonNull(target, "target"));
  }

  public String sceneId() {
    return sceneId;
  }

  /**
   * Resolves the UI object if it is still reachable.
   *
   * @return referent, or empty once the host released it
   */
  public Optional<Object> resolve() {
    return Optional.ofNullable(target.get());
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SceneRef that)) {
      return false;
    }
    return sceneId.equals(that.sceneId);
  }

  @Override
  public int hashCode() {
    return sceneId.hashCode();
  }

  @Override
  public String toString() {
    return "SceneRef[" + sceneId + (target.get() == null ? ", released]" : "]");
  }
}
