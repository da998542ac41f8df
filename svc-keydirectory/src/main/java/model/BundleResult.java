package model;

import java.util.UUID;

/**
 * Outcome of a bundle lookup. Not-found and exhaustion are ordinary results,
 * not exceptions.
 */
public class BundleResult
{
  public enum Status
  {
    /** Complete bundle including a freshly claimed one-time pre-key. */
    FOUND,
    /** Bundle without one-time pre-key; the user's pool is empty. */
    EXHAUSTED,
    /** The user has no identity key or no signed pre-key. */
    NOT_FOUND
  }

  private final Status       status;
  private final UUID         userId;
  private final PreKeyBundle bundle;

  private BundleResult( Status status, UUID userId, PreKeyBundle bundle )
  {
    this.status = status;
    this.userId = userId;
    this.bundle = bundle;
  }

  public static BundleResult found( PreKeyBundle bundle )
  {
    return new BundleResult( Status.FOUND, bundle.getUserId(), bundle );
  }

  public static BundleResult exhausted( PreKeyBundle bundle )
  {
    return new BundleResult( Status.EXHAUSTED, bundle.getUserId(), bundle );
  }

  public static BundleResult notFound( UUID userId )
  {
    return new BundleResult( Status.NOT_FOUND, userId, null );
  }

  public Status       getStatus() { return status; }
  public UUID         getUserId() { return userId; }

  /**
   * @return the bundle, or null for {@link Status#NOT_FOUND}
   */
  public PreKeyBundle getBundle() { return bundle; }

  public boolean isFound()
  {
    return status != Status.NOT_FOUND;
  }

  @Override
  public String toString()
  {
    return "BundleResult{status=" + status + ", userId=" + userId + '}';
  }
}
