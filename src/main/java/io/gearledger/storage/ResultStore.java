package io.gearledger.storage;

import io.gearledger.model.ResultRecord;
import io.gearledger.model.UpsertOutcome;
import io.gearledger.util.Artikuls;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

public final class ResultStore {
    public static final Set<String> UPDATABLE_FIELDS = Set.of(
            "artikul",
            "client",
            "quantity",
            "weight",
            "brand",
            "description",
            "sale_price",
            "total_price"
    );

    private static final String SELECT_COLUMNS = """
            SELECT id,artikul,client,quantity,weight,brand,description,sale_price,total_price,
                   last_updated_ms,created_at_ms
            FROM results
            """;

    private final Database database;
    private final LongSupplier clock;

    public ResultStore(Database database) {
        this(database, System::currentTimeMillis);
    }

    public ResultStore(Database database, LongSupplier clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Inserts a row for a new (artikul, client) pair or merges into the existing one.
     * On merge the quantity is added, price and text fields are only replaced by
     * non-empty values, and weight keeps the value it was inserted with.
     */
    public UpsertOutcome upsert(ResultWrite w) {
        if (w.artikul() == null || w.artikul().isBlank()) {
            throw new IllegalArgumentException("artikul must not be blank");
        }
        if (w.client() == null || w.client().isBlank()) {
            throw new IllegalArgumentException("client must not be blank");
        }
        if (w.quantity() < 0) {
            throw new IllegalArgumentException("quantity must not be negative: " + w.quantity());
        }
        String normalized = Artikuls.normalize(w.artikul());
        String clientKey = Artikuls.clientKey(w.client());
        String brand = w.brand() == null ? "" : w.brand();
        String description = w.description() == null ? "" : w.description();
        long nowMs = clock.getAsLong();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                UpsertOutcome out;
                try (PreparedStatement find = c.prepareStatement(
                        "SELECT id,quantity,sale_price FROM results WHERE normalized_key=? AND client_key=?")) {
                    find.setString(1, normalized);
                    find.setString(2, clientKey);
                    try (ResultSet rs = find.executeQuery()) {
                        if (rs.next()) {
                            long id = rs.getLong("id");
                            int newQuantity;
                            try {
                                newQuantity = Math.addExact(rs.getInt("quantity"), w.quantity());
                            } catch (ArithmeticException e) {
                                throw new IllegalArgumentException("quantity overflow for " + w.artikul() + " / " + w.client(), e);
                            }
                            double price = w.salePrice() > 0 ? w.salePrice() : rs.getDouble("sale_price");
                            try (PreparedStatement up = c.prepareStatement("""
                                    UPDATE results
                                    SET quantity=?,
                                        sale_price=?,
                                        total_price=?,
                                        brand=COALESCE(NULLIF(?, ''), brand),
                                        description=COALESCE(NULLIF(?, ''), description),
                                        last_updated_ms=?
                                    WHERE id=?
                                    """)) {
                                up.setInt(1, newQuantity);
                                up.setDouble(2, price);
                                up.setDouble(3, price * newQuantity);
                                up.setString(4, brand);
                                up.setString(5, description);
                                up.setLong(6, nowMs);
                                up.setLong(7, id);
                                up.executeUpdate();
                            }
                            out = UpsertOutcome.updated(id);
                        } else {
                            out = UpsertOutcome.inserted(insert(c, w, normalized, clientKey, brand, description, nowMs));
                        }
                    }
                }
                c.commit();
                return out;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert result: " + w.artikul() + " / " + w.client(), e);
        }
    }

    private long insert(
            Connection c,
            ResultWrite w,
            String normalized,
            String clientKey,
            String brand,
            String description,
            long nowMs
    ) throws SQLException {
        try (PreparedStatement ins = c.prepareStatement("""
                INSERT INTO results(artikul,normalized_key,client,client_key,quantity,weight,brand,description,
                                    sale_price,total_price,last_updated_ms,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                """, Statement.RETURN_GENERATED_KEYS)) {
            ins.setString(1, w.artikul());
            ins.setString(2, normalized);
            ins.setString(3, w.client());
            ins.setString(4, clientKey);
            ins.setInt(5, w.quantity());
            ins.setDouble(6, w.weight());
            ins.setString(7, brand);
            ins.setString(8, description);
            ins.setDouble(9, w.salePrice());
            ins.setDouble(10, w.salePrice() * w.quantity());
            ins.setLong(11, nowMs);
            ins.setLong(12, nowMs);
            ins.executeUpdate();
            try (ResultSet keys = ins.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("Insert into results returned no generated id");
                }
                return keys.getLong(1);
            }
        }
    }

    public Optional<ResultRecord> get(long id) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(SELECT_COLUMNS + " WHERE id=?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapRow(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read result " + id, e);
        }
    }

    /**
     * All rows, most recently updated first. A non-blank client restricts the list
     * to that client, compared case-insensitively.
     */
    public List<ResultRecord> list(String client) {
        boolean filtered = client != null && !client.isBlank();
        String sql = SELECT_COLUMNS
                + (filtered ? " WHERE client_key=?" : "")
                + " ORDER BY last_updated_ms DESC, id DESC";
        List<ResultRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (filtered) {
                ps.setString(1, Artikuls.clientKey(client));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRow(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list results", e);
        }
    }

    public UpdateStatus update(long id, Map<String, ?> fields) {
        LinkedHashMap<String, Object> accepted = new LinkedHashMap<>();
        if (fields != null) {
            for (Map.Entry<String, ?> e : fields.entrySet()) {
                if (UPDATABLE_FIELDS.contains(e.getKey())) {
                    accepted.put(e.getKey(), coerce(e.getKey(), e.getValue()));
                }
            }
        }
        if (accepted.isEmpty()) {
            return UpdateStatus.NO_FIELDS;
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                Optional<ResultRecord> current = get(c, id);
                if (current.isEmpty()) {
                    c.rollback();
                    return UpdateStatus.NOT_FOUND;
                }
                if (accepted.containsKey("artikul") || accepted.containsKey("client")) {
                    String artikul = (String) accepted.getOrDefault("artikul", current.get().artikul());
                    String client = (String) accepted.getOrDefault("client", current.get().client());
                    String normalized = Artikuls.normalize(artikul);
                    String clientKey = Artikuls.clientKey(client);
                    long other = findId(c, normalized, clientKey);
                    if (other > 0 && other != id) {
                        throw new IllegalArgumentException(
                                "result " + id + " would collide with result " + other + " for " + artikul + " / " + client
                        );
                    }
                    accepted.put("normalized_key", normalized);
                    accepted.put("client_key", clientKey);
                }
                accepted.put("last_updated_ms", clock.getAsLong());

                List<String> assignments = new ArrayList<>();
                for (String column : accepted.keySet()) {
                    assignments.add(column + "=?");
                }
                String sql = "UPDATE results SET " + String.join(",", assignments) + " WHERE id=?";
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    int i = 1;
                    for (Object value : accepted.values()) {
                        ps.setObject(i++, value);
                    }
                    ps.setLong(i, id);
                    ps.executeUpdate();
                }
                c.commit();
                return UpdateStatus.UPDATED;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update result " + id, e);
        }
    }

    public boolean delete(long id) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM results WHERE id=?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete result " + id, e);
        }
    }

    /** Deletes every row, or only the rows of {@code client} when it is non-blank. */
    public int clear(String client) {
        boolean scoped = client != null && !client.isBlank();
        String sql = scoped ? "DELETE FROM results WHERE client_key=?" : "DELETE FROM results";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (scoped) {
                ps.setString(1, Artikuls.clientKey(client));
            }
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear results", e);
        }
    }

    public List<String> clients() {
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT DISTINCT client FROM results ORDER BY client");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list clients", e);
        }
    }

    public Map<String, List<ResultRecord>> exportByClient() {
        Map<String, List<ResultRecord>> out = new LinkedHashMap<>();
        for (ResultRecord r : list(null)) {
            out.computeIfAbsent(r.client(), k -> new ArrayList<>()).add(r);
        }
        return out;
    }

    private Optional<ResultRecord> get(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT_COLUMNS + " WHERE id=?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    private long findId(Connection c, String normalized, String clientKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id FROM results WHERE normalized_key=? AND client_key=?")) {
            ps.setString(1, normalized);
            ps.setString(2, clientKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : -1L;
            }
        }
    }

    private static Object coerce(String field, Object value) {
        try {
            switch (field) {
                case "quantity" -> {
                    int quantity = value instanceof Number n
                            ? exactInt(n)
                            : Integer.parseInt(String.valueOf(value).trim());
                    if (quantity < 0) {
                        throw new IllegalArgumentException("quantity must not be negative: " + value);
                    }
                    return quantity;
                }
                case "weight", "sale_price", "total_price" -> {
                    return value instanceof Number n ? n.doubleValue() : Double.parseDouble(String.valueOf(value).trim());
                }
                default -> {
                    String text = value == null ? "" : String.valueOf(value);
                    if (("artikul".equals(field) || "client".equals(field)) && text.isBlank()) {
                        throw new IllegalArgumentException(field + " must not be blank");
                    }
                    return text;
                }
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + field + ": " + value, e);
        }
    }

    private static int exactInt(Number n) {
        if (n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return n.intValue();
        }
        double d = n.doubleValue();
        if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("quantity must be an int: " + n);
        }
        if (n instanceof Long l) {
            return Math.toIntExact(l);
        }
        return (int) d;
    }

    private static ResultRecord mapRow(ResultSet rs) throws SQLException {
        return new ResultRecord(
                rs.getLong("id"),
                rs.getString("artikul"),
                rs.getString("client"),
                rs.getInt("quantity"),
                rs.getDouble("weight"),
                rs.getString("brand"),
                rs.getString("description"),
                rs.getDouble("sale_price"),
                rs.getDouble("total_price"),
                Instant.ofEpochMilli(rs.getLong("last_updated_ms")).toString(),
                Instant.ofEpochMilli(rs.getLong("created_at_ms")).toString()
        );
    }

    public enum UpdateStatus {
        UPDATED,
        NOT_FOUND,
        NO_FIELDS
    }

    public record ResultWrite(
            String artikul,
            String client,
            int quantity,
            double weight,
            String brand,
            String description,
            double salePrice
    ) {
    }
}
