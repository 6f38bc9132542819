package org.morm.migration;

import lombok.Getter;
import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.naming.Naming;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class AlterTableBuilder {
    @Getter
    private final String tableName;
    @Getter
    private final DdlDialect dialect;
    private final Naming naming;
    @Getter
    private final List<DdlContributor> units = new ArrayList<>();

    public AlterTableBuilder(String tableName, DdlDialect dialect, Naming naming) {
        this.tableName = tableName;
        this.dialect = dialect;
        this.naming = naming;
    }

    public AlterTableBuilder add(DdlContributor unit) {
        units.add(unit);
        return this;
    }

    /**
     * Statements ordered by contributor priority. The sort is stable, so changes of the same
     * phase keep the order the differs produced them in.
     */
    public List<String> build() {
        List<String> statements = new ArrayList<>();
        units.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(statements, dialect, naming));
        return statements;
    }
}
