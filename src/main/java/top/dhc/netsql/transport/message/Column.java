package top.dhc.netsql.transport.message;

import java.util.Objects;

import com.google.common.base.Preconditions;

public final class Column {
    private final String name;
    private final SqlType type;

    public Column(String name, SqlType type) {
        this.name = Preconditions.checkNotNull(name, "name");
        this.type = Preconditions.checkNotNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public SqlType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Column)) {
            return false;
        }
        Column other = (Column) o;
        return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + " " + type;
    }
}
