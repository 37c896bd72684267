package dev.blog.platform.config.typehandler;

import dev.blog.platform.domain.Password;
import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * MyBatis TypeHandler for the Password value type
 * Maps between the encoded Argon2 hash and a VARCHAR column without rehashing
 */
@MappedTypes(Password.class)
public class PasswordTypeHandler extends BaseTypeHandler<Password> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, Password parameter, JdbcType jdbcType) throws SQLException {
        ps.setString(i, parameter.encoded());
    }

    @Override
    public Password getNullableResult(ResultSet rs, String columnName) throws SQLException {
        String value = rs.getString(columnName);
        return value == null ? null : Password.fromHash(value);
    }

    @Override
    public Password getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        String value = rs.getString(columnIndex);
        return value == null ? null : Password.fromHash(value);
    }

    @Override
    public Password getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        String value = cs.getString(columnIndex);
        return value == null ? null : Password.fromHash(value);
    }
}
