package com.projectgroup5.blobarena.service;

import com.projectgroup5.blobarena.config.GameProperties;
import com.projectgroup5.blobarena.game.GameManager;
import com.projectgroup5.blobarena.game.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 握手校验：名字长度/字符集、重名、容量
 * 重名和容量检查在世界锁内完成，两个同名的并发握手只有一个能成功
 */
@Service
public class AuthService {
    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    // 字母（含中文）、数字、下划线、连字符、点
    private static final Pattern NAME_PATTERN = Pattern.compile("[\\p{L}\\p{N}_.\\-]+");
    private static final int MAX_SUGGESTIONS = 3;

    private final GameManager gameManager;
    private final int minLength;
    private final int maxLength;

    public AuthService(GameManager gameManager, GameProperties properties) {
        this.gameManager = gameManager;
        this.minLength = properties.getPlayer().getNameMinLength();
        this.maxLength = properties.getPlayer().getNameMaxLength();
    }

    /**
     * 校验名字并把玩家加入世界
     *
     * @return 出生点
     */
    public Point join(int playerId, String rawName) throws ValidationException {
        String name = normalize(rawName);
        validateName(name);
        return gameManager.addPlayer(playerId, name);
    }

    public void validateName(String name) throws ValidationException {
        if (name == null || name.isEmpty()) {
            throw new ValidationException(ValidationException.Reason.INVALID_NAME, "Name is required");
        }
        int length = name.codePointCount(0, name.length());
        if (length < minLength || length > maxLength) {
            throw new ValidationException(ValidationException.Reason.INVALID_NAME,
                    "Name must be " + minLength + "-" + maxLength + " characters");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new ValidationException(ValidationException.Reason.INVALID_NAME,
                    "Name contains invalid characters");
        }
    }

    /**
     * 给重名的玩家推荐几个当前可用的名字
     */
    public List<String> suggestNames(String rawName) {
        String base = normalize(rawName);
        List<String> suggestions = new ArrayList<>();
        if (base == null || base.isEmpty()) {
            return suggestions;
        }
        for (int i = 1; i < 100 && suggestions.size() < MAX_SUGGESTIONS; i++) {
            String suffix = String.valueOf(i);
            String head = base;
            if (head.length() + suffix.length() > maxLength) {
                head = head.substring(0, Math.max(0, maxLength - suffix.length()));
            }
            String candidate = head + suffix;
            try {
                validateName(candidate);
            } catch (ValidationException e) {
                continue;
            }
            if (!gameManager.isNameTaken(candidate)) {
                suggestions.add(candidate);
            }
        }
        logger.debug("Suggestions for '{}': {}", base, suggestions);
        return suggestions;
    }

    private static String normalize(String name) {
        return name == null ? null : name.strip();
    }
}
