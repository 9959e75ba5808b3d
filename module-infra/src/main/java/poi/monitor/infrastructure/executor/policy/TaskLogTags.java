package poi.monitor.infrastructure.executor.policy;

/** Log tags shared by the executor log lines. */
public final class TaskLogTags {

  public static final String TAG_SUCCESS = "[Task:SUCCESS]";

  public static final String TAG_SLOW = "[Task:SLOW]";

  public static final String TAG_FAILURE = "[Task:FAILURE]";

  public static final String TAG_RECOVERED = "[Task:RECOVERED]";

  private TaskLogTags() {}
}
