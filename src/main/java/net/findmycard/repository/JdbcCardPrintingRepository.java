package net.findmycard.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.findmycard.model.CardFace;
import net.findmycard.model.CardPrices;
import net.findmycard.model.CardPrinting;
import net.findmycard.model.Legality;
import net.findmycard.model.ManaColor;
import net.findmycard.model.Rarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres-backed printing store over the {@code card_printings} table.
 *
 * <p>Scalar attributes live in typed columns; collections, faces, prices and
 * legalities are stored as JSON text so the table shape stays stable when the
 * card-data feed adds fields. SQL sticks to portable statements (update, then
 * insert on miss) so the same repository runs against H2 in tests.</p>
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcCardPrintingRepository implements CardPrintingRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCardPrintingRepository.class);

    private static final TypeReference<Set<ManaColor>> COLOR_SET = new TypeReference<>() { };
    private static final TypeReference<Set<String>> STRING_SET = new TypeReference<>() { };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() { };
    private static final TypeReference<List<CardFace>> FACE_LIST = new TypeReference<>() { };
    private static final TypeReference<Map<String, Legality>> LEGALITY_MAP = new TypeReference<>() { };

    private static final String SELECT_COLUMNS = """
            SELECT printing_id, oracle_id, name, type_line, oracle_text, mana_cost, cmc,
                   colors, color_identity, keywords, set_code, set_name, rarity,
                   image_uris, card_faces, price_usd, price_usd_foil, price_eur, price_tix,
                   legalities, power, toughness
            FROM card_printings
            """;

    private static final String UPDATE_SQL = """
            UPDATE card_printings
               SET oracle_id = ?, name = ?, type_line = ?, oracle_text = ?, mana_cost = ?, cmc = ?,
                   colors = ?, color_identity = ?, keywords = ?, set_code = ?, set_name = ?, rarity = ?,
                   image_uris = ?, card_faces = ?, price_usd = ?, price_usd_foil = ?, price_eur = ?,
                   price_tix = ?, legalities = ?, power = ?, toughness = ?, updated_at = CURRENT_TIMESTAMP
             WHERE printing_id = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO card_printings (oracle_id, name, type_line, oracle_text, mana_cost, cmc,
                   colors, color_identity, keywords, set_code, set_name, rarity,
                   image_uris, card_faces, price_usd, price_usd_foil, price_eur,
                   price_tix, legalities, power, toughness, printing_id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<CardPrinting> rowMapper = this::mapRow;

    public JdbcCardPrintingRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<CardPrinting> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY printing_id", rowMapper);
    }

    @Override
    public Optional<CardPrinting> findById(String printingId) {
        if (printingId == null || printingId.isBlank()) {
            return Optional.empty();
        }
        List<CardPrinting> rows = jdbcTemplate.query(SELECT_COLUMNS + " WHERE printing_id = ?", rowMapper, printingId);
        return rows.stream().findFirst();
    }

    @Override
    @Transactional
    public int upsertAll(Collection<CardPrinting> printings) {
        if (printings == null || printings.isEmpty()) {
            return 0;
        }
        int written = 0;
        for (CardPrinting printing : printings) {
            int updated = jdbcTemplate.update(UPDATE_SQL, ps -> bind(ps, printing));
            if (updated == 0) {
                jdbcTemplate.update(INSERT_SQL, ps -> bind(ps, printing));
            }
            written++;
        }
        log.debug("Upserted {} card printings", written);
        return written;
    }

    @Override
    @Transactional
    public int replaceAll(Collection<CardPrinting> printings) {
        int removed = jdbcTemplate.update("DELETE FROM card_printings");
        log.info("Cleared {} card printings ahead of full re-import", removed);
        return upsertAll(printings);
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM card_printings", Long.class);
        return count != null ? count : 0L;
    }

    private void bind(PreparedStatement ps, CardPrinting printing) throws SQLException {
        int i = 1;
        ps.setString(i++, printing.oracleId());
        ps.setString(i++, printing.name());
        ps.setString(i++, printing.typeLine());
        ps.setString(i++, printing.oracleText());
        ps.setString(i++, printing.manaCost());
        ps.setBigDecimal(i++, BigDecimal.valueOf(printing.convertedManaCost()));
        ps.setString(i++, toJson(printing.colors()));
        ps.setString(i++, toJson(printing.colorIdentity()));
        ps.setString(i++, toJson(printing.keywords()));
        ps.setString(i++, printing.setCode());
        ps.setString(i++, printing.setName());
        ps.setString(i++, printing.rarity() != null ? printing.rarity().wireValue() : null);
        ps.setString(i++, toJson(printing.imageUris()));
        ps.setString(i++, toJson(printing.cardFaces()));
        setPrice(ps, i++, printing.prices().usd());
        setPrice(ps, i++, printing.prices().usdFoil());
        setPrice(ps, i++, printing.prices().eur());
        setPrice(ps, i++, printing.prices().tix());
        ps.setString(i++, toJson(printing.legalities()));
        ps.setString(i++, printing.power());
        ps.setString(i++, printing.toughness());
        ps.setString(i, printing.printingId());
    }

    private static void setPrice(PreparedStatement ps, int index, BigDecimal value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.NUMERIC);
        } else {
            ps.setBigDecimal(index, value);
        }
    }

    private CardPrinting mapRow(ResultSet rs, int rowNum) throws SQLException {
        String printingId = rs.getString("printing_id");
        return new CardPrinting(
            printingId,
            rs.getString("oracle_id"),
            rs.getString("name"),
            rs.getString("type_line"),
            rs.getString("oracle_text"),
            rs.getString("mana_cost"),
            rs.getBigDecimal("cmc") != null ? rs.getBigDecimal("cmc").doubleValue() : 0.0,
            fromJson(rs.getString("colors"), COLOR_SET, printingId),
            fromJson(rs.getString("color_identity"), COLOR_SET, printingId),
            fromJson(rs.getString("keywords"), STRING_SET, printingId),
            rs.getString("set_code"),
            rs.getString("set_name"),
            Rarity.fromWireValue(rs.getString("rarity")).orElse(null),
            fromJson(rs.getString("image_uris"), STRING_MAP, printingId),
            fromJson(rs.getString("card_faces"), FACE_LIST, printingId),
            new CardPrices(
                rs.getBigDecimal("price_usd"),
                rs.getBigDecimal("price_usd_foil"),
                rs.getBigDecimal("price_eur"),
                rs.getBigDecimal("price_tix")),
            fromJson(rs.getString("legalities"), LEGALITY_MAP, printingId),
            rs.getString("power"),
            rs.getString("toughness")
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize card printing column", ex);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, String printingId) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt JSON column for printing " + printingId, ex);
        }
    }
}
