package com.example.librarysync.common.logging;

public final class MdcKeys {

    public static final String REQUEST_ID = "requestId";
    public static final String METHOD = "method";
    public static final String URI = "uri";

    public static final String TASK_ID = "taskId";
    public static final String TASK_TYPE = "taskType";
    public static final String ACCOUNT_ID = "accountId";

    private MdcKeys() {
    }
}
