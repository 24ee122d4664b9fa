package com.flagship.gift_card_ledger.directory;

import com.flagship.gift_card_ledger.exception.NotFoundException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Lookups against the franchise/establishment directory.
 *
 * The directory is owned by the administration module. This service only
 * reads from it and never takes locks on its rows.
 */
@Service
public class EstablishmentDirectory {

    private static final String SELECT_PROFILE =
        "SELECT e.id, e.franchise_id, e.name, e.category, e.document, e.email, e.phone, f.commission_rate " +
        "FROM establishments e JOIN franchises f ON f.id = e.franchise_id ";

    private final JdbcTemplate jdbcTemplate;

    public EstablishmentDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<EstablishmentProfile> findEstablishment(UUID establishmentId) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(
                SELECT_PROFILE + "WHERE e.id = ?",
                profileRowMapper(),
                establishmentId
            ));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    public EstablishmentProfile getEstablishment(UUID establishmentId) {
        return findEstablishment(establishmentId)
            .orElseThrow(() -> new NotFoundException("Establishment", establishmentId));
    }

    public boolean franchiseExists(UUID franchiseId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM franchises WHERE id = ?",
            Integer.class,
            franchiseId
        );
        return count != null && count > 0;
    }

    private RowMapper<EstablishmentProfile> profileRowMapper() {
        return (rs, rowNum) -> new EstablishmentProfile(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("franchise_id")),
            rs.getString("name"),
            rs.getString("category"),
            rs.getString("document"),
            rs.getString("email"),
            rs.getString("phone"),
            rs.getBigDecimal("commission_rate")
        );
    }
}
