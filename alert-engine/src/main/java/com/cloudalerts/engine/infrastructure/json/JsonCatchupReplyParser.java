package com.cloudalerts.engine.infrastructure.json;

import com.cloudalerts.common.handle.Handles;
import com.cloudalerts.common.json.JacksonConfig;
import com.cloudalerts.engine.domain.alert.PendingContactUser;
import com.cloudalerts.engine.domain.raw.CatchupReply;
import com.cloudalerts.engine.domain.raw.RawAlertRecord;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads the JSON reply to the initial alert query:
 * <pre>{"c": [records...], "u": [{"u": handle, "m": email, "m2": [emails], "n": name}], "ltd": delta}</pre>
 * Records without a type code are skipped.
 */
@Slf4j
public class JsonCatchupReplyParser {

    private static final String RECORDS = "c";
    private static final String USERS = "u";
    private static final String LAST_SEEN_TIME_DELTA = "ltd";

    private static final String USER_HANDLE = "u";
    private static final String USER_EMAIL = "m";
    private static final String USER_ALTERNATE_EMAILS = "m2";
    private static final String USER_NAME = "n";

    private final ObjectMapper objectMapper;

    public JsonCatchupReplyParser() {
        this(JacksonConfig.createObjectMapper());
    }

    public JsonCatchupReplyParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** @throws IllegalArgumentException when the text is not a JSON object */
    public CatchupReply parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JacksonException e) {
            throw new IllegalArgumentException("Malformed catch-up reply: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Catch-up reply is not a JSON object");
        }

        var ltd = root.get(LAST_SEEN_TIME_DELTA);
        return CatchupReply.builder()
                .records(records(root.path(RECORDS)))
                .pendingContactUsers(users(root.path(USERS)))
                .lastSeenTimeDelta(ltd != null && ltd.isNumber() ? ltd.asLong() : null)
                .build();
    }

    private List<RawAlertRecord> records(JsonNode array) {
        var records = new ArrayList<RawAlertRecord>();
        for (JsonNode element : array) {
            var record = new JsonRawAlertRecord(element);
            if (!element.isObject() || record.type() == null) {
                log.warn("Skipping catch-up record without type: {}", element);
                continue;
            }
            records.add(record);
        }
        return records;
    }

    private static List<PendingContactUser> users(JsonNode array) {
        var users = new ArrayList<PendingContactUser>();
        for (JsonNode element : array) {
            var user = new JsonRawAlertRecord(element);
            long handle = user.getHandle(USER_HANDLE, Handles.USER_HANDLE_SIZE, Handles.UNDEF);
            if (Handles.isUndef(handle)) {
                continue;
            }
            users.add(PendingContactUser.builder()
                    .userHandle(handle)
                    .email(user.getString(USER_EMAIL, ""))
                    .alternateEmails(user.getStringArray(USER_ALTERNATE_EMAILS))
                    .name(user.getString(USER_NAME, ""))
                    .build());
        }
        return users;
    }
}
