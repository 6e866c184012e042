package com.my.relay.domain.model;

/**
 * 왜: 발신자 정보를 최소 필드로 고정하고 로그/리스너에서 쓰는 표시 이름 규칙을 한 곳에 두기 위함.
 */
public record TelegramUser(long id, boolean bot, String firstName, String lastName, String username) {

    public static TelegramUser unknown() {
        return new TelegramUser(0L, false, null, null, null);
    }

    /**
     * username이 있으면 username, 없으면 "이름 성".
     */
    public String shortName() {
        if (username != null && !username.isBlank()) {
            return username;
        }
        return fullName();
    }

    /**
     * username 뒤에 " (이름 성)"을 붙이고 봇이면 표식을 덧붙인다. username이 없어도 구분 공백은 남는다.
     */
    public String displayName() {
        StringBuilder result = new StringBuilder(username == null ? "" : username);
        if (hasName()) {
            result.append(" (").append(fullName()).append(')');
        }
        if (bot) {
            result.append("*BOT*");
        }
        return result.toString();
    }

    /**
     * username, 없으면 "이름 성". 봇이면 " (bot)"을 붙인다.
     */
    public String usernameOrName() {
        String result = username == null ? "" : username;
        if (result.isBlank() && hasName()) {
            result = fullName();
        }
        if (bot) {
            result += " (bot)";
        }
        return result;
    }

    private boolean hasName() {
        return (firstName != null && !firstName.isEmpty()) || (lastName != null && !lastName.isEmpty());
    }

    private String fullName() {
        String first = firstName == null ? "" : firstName;
        String last = lastName == null ? "" : lastName;
        return (first + " " + last).trim();
    }
}
