package swiss.sib.swissprot.t2s.source;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import swiss.sib.swissprot.t2s.SourceUnavailableException;

/**
 * Rows of a SQL query, or of a whole table, over JDBC.
 */
public class JdbcRowSource implements RowSource {
	private static final Logger logger = LoggerFactory.getLogger(JdbcRowSource.class);

	private final String jdbc;
	private final String query;
	private final Map<String, String> credentials;

	public JdbcRowSource(String jdbc, String query, Map<String, String> credentials) {
		this.jdbc = jdbc;
		this.query = query;
		this.credentials = credentials == null ? Map.of() : credentials;
	}

	/**
	 * @param driver e.g. "duckdb" or "h2"
	 * @param path   what follows <code>jdbc:driver:</code>
	 */
	public static String jdbcUrl(String driver, String path) {
		if (path.startsWith("jdbc:")) {
			return path;
		}
		return "jdbc:" + driver + ":" + path;
	}

	public static String tableQuery(String table) {
		return "SELECT * FROM " + table;
	}

	public static Connection openByJdbc(String jdbc, Map<String, String> credentials) throws SQLException {
		Properties properties = new Properties();
		String user = credentials.get("username");
		if (user == null) {
			user = credentials.get("user");
		}
		if (user != null) {
			properties.setProperty("user", user);
		}
		String password = credentials.get("password");
		if (password != null) {
			properties.setProperty("password", password);
		}
		return DriverManager.getConnection(jdbc, properties);
	}

	@Override
	public List<Row> rows() throws SourceUnavailableException {
		List<Row> rows = new ArrayList<>();
		try (Connection conn = openByJdbc(jdbc, credentials);
				Statement s = conn.createStatement();
				ResultSet rs = s.executeQuery(query)) {
			ResultSetMetaData md = rs.getMetaData();
			int columns = md.getColumnCount();
			String[] names = new String[columns];
			for (int i = 0; i < columns; i++) {
				names[i] = md.getColumnLabel(i + 1);
			}
			long index = 1;
			while (rs.next()) {
				Map<String, String> values = new LinkedHashMap<>();
				for (int i = 0; i < columns; i++) {
					Object o = rs.getObject(i + 1);
					if (o != null) {
						values.put(names[i], o.toString());
					}
				}
				rows.add(new Row(index++, values));
			}
		} catch (SQLException e) {
			throw new SourceUnavailableException(describe(), e);
		}
		logger.debug("Read " + rows.size() + " rows with " + query);
		return rows;
	}

	@Override
	public String describe() {
		return jdbc + " " + query;
	}
}
