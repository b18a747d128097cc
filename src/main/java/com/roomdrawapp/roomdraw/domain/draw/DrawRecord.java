package com.roomdrawapp.roomdraw.domain.draw;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One participant row of a draw list.
 *
 * @param identity    participant ID, or {@code null} when the row carried a blank ID
 * @param firstName   first name as it appeared in the source
 * @param lastName    last name as it appeared in the source
 * @param drawTime    parsed draw slot
 * @param drawTimeText draw slot exactly as it appeared in the source
 * @param originIndex zero-based data-row position in the source, unique per source
 */
public record DrawRecord(
        String identity,
        String firstName,
        String lastName,
        LocalDateTime drawTime,
        String drawTimeText,
        int originIndex
) {

    public DrawRecord {
        if (drawTime == null) throw new IllegalArgumentException("drawTime is required");
        if (originIndex < 0) throw new IllegalArgumentException("originIndex must be >= 0");
        firstName = firstName == null ? "" : firstName;
        lastName = lastName == null ? "" : lastName;
    }

    public boolean hasIdentity() {
        return identity != null && !identity.isBlank();
    }

    public String displayName() {
        return (firstName.trim() + " " + lastName.trim()).trim();
    }

    public boolean matchesName(String first, String last) {
        return normName(firstName).equals(normName(first)) && normName(lastName).equals(normName(last));
    }

    /** Row-shaped view for anomaly reports. */
    public Map<String, String> snapshot() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("identity", identity == null ? "" : identity);
        m.put("firstName", firstName);
        m.put("lastName", lastName);
        m.put("drawTime", drawTimeText);
        m.put("originIndex", String.valueOf(originIndex));
        return m;
    }

    private static String normName(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
