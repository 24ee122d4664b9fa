package com.flagship.gift_card_ledger.giftcard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gift_card_ledger.directory.EstablishmentDirectory;
import com.flagship.gift_card_ledger.directory.EstablishmentProfile;
import com.flagship.gift_card_ledger.exception.ConflictException;
import com.flagship.gift_card_ledger.exception.InsufficientBalanceException;
import com.flagship.gift_card_ledger.exception.InvalidOperationException;
import com.flagship.gift_card_ledger.exception.NotFoundException;
import com.flagship.gift_card_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of gift cards and their transactions; the only writer of
 * balance state.
 *
 * Invariants enforced here and backed by the schema:
 * 1. A balance change and its transaction row commit together or not at all
 * 2. Changes to one card are serialized by a row lock on {@code gift_cards}
 * 3. Transactions are append-only and form a gapless chain per card
 *    (CHECK constraint plus chain trigger in the migration)
 *
 * Plain JDBC keeps the locking and the statements explicit.
 */
@Service
@Slf4j
public class LedgerStore {

    private static final String CARD_COLUMNS =
        "id, code, franchise_id, establishment_id, initial_value, current_balance, " +
        "status, valid_until, created_at, updated_at";

    private static final String TRANSACTION_COLUMNS =
        "id, gift_card_id, establishment_id, type, amount, balance_before, balance_after, " +
        "description, metadata, sequence_number, created_at";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final EstablishmentDirectory directory;
    private final GiftCardCodeGenerator codeGenerator;
    private final ObjectMapper objectMapper;

    @Value("${gift-card.code.max-attempts:5}")
    private int maxCodeAttempts;

    public LedgerStore(JdbcTemplate jdbcTemplate,
                       EstablishmentDirectory directory,
                       GiftCardCodeGenerator codeGenerator,
                       ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.directory = directory;
        this.codeGenerator = codeGenerator;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates an ACTIVE card with {@code currentBalance = initialValue}.
     *
     * Runs outside any caller transaction: a unique-code violation aborts the
     * surrounding PostgreSQL transaction, so every attempt must be its own
     * statement-level unit.
     *
     * @throws ValidationException if the value is not positive, the validity
     *         is in the past, or the establishment is not part of the franchise
     * @throws NotFoundException if the establishment does not exist
     * @throws ConflictException if no unique code was found within the retry bound
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public GiftCard createGiftCard(UUID franchiseId, UUID establishmentId,
                                   BigDecimal initialValue, Instant validUntil) {
        if (initialValue == null || initialValue.signum() <= 0) {
            throw new ValidationException("Initial value must be greater than zero",
                Map.of("initialValue", String.valueOf(initialValue)));
        }
        if (initialValue.stripTrailingZeros().scale() > 2) {
            throw new ValidationException("Initial value must have at most two decimal places",
                Map.of("initialValue", initialValue));
        }
        if (validUntil != null && !validUntil.isAfter(Instant.now())) {
            throw new ValidationException("Validity date must be in the future",
                Map.of("validUntil", validUntil.toString()));
        }

        EstablishmentProfile establishment = directory.getEstablishment(establishmentId);
        if (!establishment.belongsTo(franchiseId)) {
            throw new ValidationException("Establishment does not belong to the franchise",
                Map.of("establishmentId", establishmentId.toString(),
                       "franchiseId", String.valueOf(franchiseId)));
        }

        for (int attempt = 1; attempt <= maxCodeAttempts; attempt++) {
            GiftCard card = GiftCard.issue(UUID.randomUUID(), codeGenerator.nextCode(),
                franchiseId, establishmentId, initialValue, validUntil);
            try {
                insertGiftCard(card);
                log.debug("Created gift card {} ({}) for establishment {}",
                    card.getId(), card.getCode(), establishmentId);
                return card;
            } catch (DuplicateKeyException e) {
                log.warn("Gift card code collision on attempt {}/{}: {}",
                    attempt, maxCodeAttempts, card.getCode());
            }
        }

        throw new ConflictException(
            "Could not generate a unique gift card code after " + maxCodeAttempts + " attempts",
            Map.of("attempts", maxCodeAttempts));
    }

    /**
     * Applies a signed balance change and writes its transaction row.
     *
     * The card row is locked with {@code SELECT ... FOR UPDATE}, so concurrent
     * calls for the same card run one after the other and each sees the balance
     * left by the previous one. Calls for different cards do not contend.
     *
     * @return the updated card and the written transaction
     * @throws NotFoundException if the card does not exist
     * @throws InsufficientBalanceException if a usage exceeds the balance, whatever
     *         the card's status
     * @throws InvalidOperationException if the card is not operable, belongs to
     *         another establishment, or a non-recharge credit would exceed the initial value
     */
    @Transactional
    public BalanceChange applyBalanceChange(BalanceChangeCommand command) {
        validateCommand(command);

        GiftCard card = lockGiftCard(command.getGiftCardId())
            .orElseThrow(() -> new NotFoundException("GiftCard", command.getGiftCardId()));

        if (!card.getEstablishmentId().equals(command.getEstablishmentId())) {
            throw new InvalidOperationException("Gift card belongs to another establishment",
                Map.of("giftCardId", card.getId().toString(),
                       "establishmentId", command.getEstablishmentId().toString()));
        }

        BigDecimal before = card.getCurrentBalance();
        BigDecimal after = before.add(command.getDelta());
        BigDecimal amount = command.getDelta().abs();

        // Checked ahead of status so an emptied (USED) card reports the shortfall.
        if (after.signum() < 0) {
            throw new InsufficientBalanceException(before, amount);
        }
        card.ensureOperable(Instant.now());
        // Recharges are uncapped; any other credit may only restore value up to the original amount.
        if (command.getType() != TransactionType.RECHARGE && after.compareTo(card.getInitialValue()) > 0) {
            throw new InvalidOperationException("Balance would exceed the card's initial value",
                Map.of("initialValue", card.getInitialValue(), "balanceAfter", after));
        }

        GiftCard updated = card.withBalance(after, command.getType());
        jdbcTemplate.update(
            "UPDATE gift_cards SET current_balance = ?, status = ?, updated_at = ? WHERE id = ?",
            updated.getCurrentBalance(),
            updated.getStatus().name(),
            Timestamp.from(updated.getUpdatedAt()),
            updated.getId()
        );

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO gift_card_transactions (id, gift_card_id, establishment_id, type, amount, " +
            "balance_before, balance_after, description, metadata, idempotency_key, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, clock_timestamp())",
            transactionId,
            card.getId(),
            command.getEstablishmentId(),
            command.getType().name(),
            amount,
            before,
            after,
            command.getDescription(),
            serializeMetadata(command.getMetadata()),
            command.getIdempotencyKey()
        );

        GiftCardTransaction transaction = findTransaction(transactionId)
            .orElseThrow(() -> new IllegalStateException("Transaction not readable after insert: " + transactionId));

        log.debug("Applied {} of {} to gift card {}: {} -> {}",
            command.getType(), amount, card.getId(), before, after);

        return new BalanceChange(updated, transaction);
    }

    /**
     * Moves an ACTIVE card to CANCELLED. No transaction is written.
     */
    @Transactional
    public GiftCard cancel(UUID giftCardId) {
        GiftCard card = lockGiftCard(giftCardId)
            .orElseThrow(() -> new NotFoundException("GiftCard", giftCardId));
        GiftCard cancelled = card.cancel();
        jdbcTemplate.update(
            "UPDATE gift_cards SET status = ?, updated_at = ? WHERE id = ?",
            cancelled.getStatus().name(),
            Timestamp.from(cancelled.getUpdatedAt()),
            giftCardId
        );
        return cancelled;
    }

    /**
     * Marks ACTIVE cards whose validity has passed as EXPIRED.
     *
     * @return number of cards expired
     */
    @Transactional
    public int expireOverdue(Instant now) {
        return jdbcTemplate.update(
            "UPDATE gift_cards SET status = 'EXPIRED', updated_at = ? " +
            "WHERE status = 'ACTIVE' AND valid_until IS NOT NULL AND valid_until <= ?",
            Timestamp.from(now),
            Timestamp.from(now)
        );
    }

    public Optional<GiftCard> findById(UUID giftCardId) {
        return queryOptional(
            "SELECT " + CARD_COLUMNS + " FROM gift_cards WHERE id = ?",
            giftCardRowMapper(), giftCardId);
    }

    /**
     * Exact, case-sensitive code lookup.
     */
    public Optional<GiftCard> findByCode(String code) {
        return queryOptional(
            "SELECT " + CARD_COLUMNS + " FROM gift_cards WHERE code = ?",
            giftCardRowMapper(), code);
    }

    /**
     * Returns the card's transactions in chain order.
     */
    public List<GiftCardTransaction> findTransactions(UUID giftCardId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM gift_card_transactions " +
            "WHERE gift_card_id = ? ORDER BY sequence_number",
            transactionRowMapper(),
            giftCardId
        );
    }

    public Optional<GiftCardTransaction> findTransaction(UUID transactionId) {
        return queryOptional(
            "SELECT " + TRANSACTION_COLUMNS + " FROM gift_card_transactions WHERE id = ?",
            transactionRowMapper(), transactionId);
    }

    public Optional<GiftCardTransaction> findTransactionByIdempotencyKey(String idempotencyKey) {
        return queryOptional(
            "SELECT " + TRANSACTION_COLUMNS + " FROM gift_card_transactions WHERE idempotency_key = ?",
            transactionRowMapper(), idempotencyKey);
    }

    /**
     * Recharge transactions older than {@code createdBefore} that have no commission row.
     */
    public List<GiftCardTransaction> findRechargesWithoutCommission(Instant createdBefore, int limit) {
        return jdbcTemplate.query(
            "SELECT t.id, t.gift_card_id, t.establishment_id, t.type, t.amount, t.balance_before, " +
            "t.balance_after, t.description, t.metadata, t.sequence_number, t.created_at " +
            "FROM gift_card_transactions t " +
            "LEFT JOIN commissions c ON c.transaction_id = t.id " +
            "WHERE t.type = 'RECHARGE' AND c.id IS NULL AND t.created_at < ? " +
            "ORDER BY t.sequence_number LIMIT ?",
            transactionRowMapper(),
            Timestamp.from(createdBefore),
            limit
        );
    }

    private Optional<GiftCard> lockGiftCard(UUID giftCardId) {
        return queryOptional(
            "SELECT " + CARD_COLUMNS + " FROM gift_cards WHERE id = ? FOR UPDATE",
            giftCardRowMapper(), giftCardId);
    }

    private void validateCommand(BalanceChangeCommand command) {
        if (command.getGiftCardId() == null || command.getEstablishmentId() == null || command.getType() == null) {
            throw new ValidationException("Gift card, establishment and transaction type are required");
        }
        BigDecimal delta = command.getDelta();
        if (delta == null || delta.signum() == 0) {
            throw new ValidationException("Amount must be non-zero");
        }
        boolean credit = command.getType().isCredit();
        if (credit != (delta.signum() > 0)) {
            throw new ValidationException(
                String.format("Delta sign does not match transaction type %s", command.getType()),
                Map.of("delta", delta, "type", command.getType().name()));
        }
    }

    private void insertGiftCard(GiftCard card) {
        jdbcTemplate.update(
            "INSERT INTO gift_cards (" + CARD_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            card.getId(),
            card.getCode(),
            card.getFranchiseId(),
            card.getEstablishmentId(),
            card.getInitialValue(),
            card.getCurrentBalance(),
            card.getStatus().name(),
            card.getValidUntil() != null ? Timestamp.from(card.getValidUntil()) : null,
            Timestamp.from(card.getCreatedAt()),
            Timestamp.from(card.getUpdatedAt())
        );
    }

    private <T> Optional<T> queryOptional(String sql, RowMapper<T> mapper, Object... args) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(sql, mapper, args));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    private String serializeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize transaction metadata", e);
        }
    }

    private Map<String, Object> deserializeMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored transaction metadata is not valid JSON", e);
        }
    }

    private RowMapper<GiftCard> giftCardRowMapper() {
        return (rs, rowNum) -> new GiftCard(
            UUID.fromString(rs.getString("id")),
            rs.getString("code"),
            UUID.fromString(rs.getString("franchise_id")),
            UUID.fromString(rs.getString("establishment_id")),
            rs.getBigDecimal("initial_value"),
            rs.getBigDecimal("current_balance"),
            GiftCardStatus.valueOf(rs.getString("status")),
            toInstant(rs, "valid_until"),
            toInstant(rs, "created_at"),
            toInstant(rs, "updated_at")
        );
    }

    private RowMapper<GiftCardTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new GiftCardTransaction(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("gift_card_id")),
            UUID.fromString(rs.getString("establishment_id")),
            TransactionType.valueOf(rs.getString("type")),
            rs.getBigDecimal("amount"),
            rs.getBigDecimal("balance_before"),
            rs.getBigDecimal("balance_after"),
            rs.getString("description"),
            deserializeMetadata(rs.getString("metadata")),
            rs.getLong("sequence_number"),
            toInstant(rs, "created_at")
        );
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
