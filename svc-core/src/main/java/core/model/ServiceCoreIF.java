package core.model;

public interface ServiceCoreIF
{
  public static final String SUCCESS = "success";

  // Key Services
  public static final String KeyDirectorySvcId = "keydirectory";

  // Message Header attributes
  public static final String MsgHeaderSourceSvcID = "SourceSvcID";
  public static final String MsgHeaderEventType   = "EventType";
  public static final String MsgHeaderTimeStamp   = "TimeStamp";
  public static final String MsgHeaderVersion     = "Version";

  // Event types
  public static final String ReplenishmentEvent = "OneTimePreKeyReplenish";

  // Subjects
  public static final String ReplenishSubjectBase = "keys.replenish.";  // + user id

  // Event bus addresses served by the key directory
  public static final String EventBusKeysUpload         = "keys.upload";
  public static final String EventBusKeysFetch          = "keys.fetch";
  public static final String EventBusKeysRotate         = "keys.rotate";
  public static final String EventBusKeysCount          = "keys.count";
  public static final String EventBusReplenishmentCheck = "keys.replenishment.check";
  public static final String EventBusRotationCheck      = "keys.rotation.check";
}
