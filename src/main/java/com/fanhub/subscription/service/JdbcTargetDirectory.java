package com.fanhub.subscription.service;

import com.fanhub.subscription.config.SubscriptionProperties;
import com.fanhub.subscription.domain.model.TargetKind;
import com.fanhub.subscription.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Target directory backed by the platform's player and team tables, which live in the same database.
 * Target ids are the numeric primary keys of those tables; anything else is reported as missing.
 *
 * @author FanHub Team
 */
@Component
public class JdbcTargetDirectory implements TargetDirectory {

    private static final Logger logger = LoggerFactory.getLogger(JdbcTargetDirectory.class);

    private final JdbcTemplate jdbcTemplate;
    private final SubscriptionProperties properties;

    public JdbcTargetDirectory(JdbcTemplate jdbcTemplate, SubscriptionProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    @Override
    public boolean exists(TargetKind kind, String targetId) {
        Long id = parseId(targetId);
        if (id == null) {
            logger.debug("Rejecting non-numeric {} id: {}", kind, targetId);
            return false;
        }

        String sql = "SELECT COUNT(*) FROM " + tableFor(kind) + " WHERE id = ?";
        try {
            Integer matches = jdbcTemplate.queryForObject(sql, Integer.class, id);
            return matches != null && matches > 0;
        } catch (DataAccessException e) {
            logger.error("Error looking up {} {} in directory", kind, targetId, e);
            throw new StorageException("targetLookup", e.getMessage(), e);
        }
    }

    private String tableFor(TargetKind kind) {
        SubscriptionProperties.Directory directory = properties.getDirectory();
        return kind == TargetKind.PLAYER ? directory.getPlayerTable() : directory.getTeamTable();
    }

    private static Long parseId(String targetId) {
        if (targetId == null || targetId.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(targetId.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
