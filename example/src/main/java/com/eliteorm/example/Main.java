package com.eliteorm.example;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import com.eliteorm.config.StoreConfig;
import com.eliteorm.db.Dao;
import com.eliteorm.db.InMemoryStore;
import com.eliteorm.db.JdbcStore;
import com.eliteorm.db.Store;
import com.eliteorm.reactive.EntityPublisher;
import com.zaxxer.hikari.HikariDataSource;
import java.util.function.Supplier;
import org.tinylog.Logger;
import reactor.core.Disposable;

/**
 * Demo of the ORM: stores a few 80s metal bands, changes and removes some of them, and logs the
 * full list each time it changes.
 *
 * <p>Runs against PostgreSQL when {@code DB_URL} (and optionally {@code DB_USER},
 * {@code DB_PASSWORD}, {@code DB_POOL_SIZE}) is set, and against an in-memory store otherwise.
 */
public class Main {

  public static void main(String[] args) {
    StoreConfig config = StoreConfig.fromEnvironment();
    if (!config.isConfigured()) {
      Logger.info("DB_URL is not set, using an in-memory store");
      exitOnError(run(new InMemoryStore()));
      return;
    }

    try (HikariDataSource dataSource = config.createDataSource()) {
      JdbcStore store = new JdbcStore(dataSource);
      Status tableStatus = store.createTable(new EightiesMetal());
      if (tableStatus.isError()) {
        exitOnError(tableStatus);
        return;
      }
      exitOnError(run(store));
    }
  }

  /**
   * Runs the demo against a store. Any bands left over from an earlier run are removed first.
   *
   * @return OK, or the first failure
   */
  static Status run(Store store) {
    EntityPublisher<EightiesMetal> bands =
        new EntityPublisher<>(new Dao<>(new EightiesMetal(), store));
    Disposable subscription =
        bands
            .all()
            .subscribe(
                list -> Logger.info("{} bands:\n{}", list.size(), BandRenderer.render(list)));
    try {
      Status status = step("clear", bands::deleteAll);
      for (EightiesMetal band : DemoData.all()) {
        if (status.isOk()) {
          status = step("add " + band.getName(), () -> bands.create(band));
        }
      }
      if (status.isOk()) {
        EightiesMetal megadeth = DemoData.megadeth();
        megadeth.setGenre(MetalSubGenre.THRASH);
        status = step("reclassify Megadeth", () -> bands.update(megadeth));
      }
      if (status.isOk()) {
        status = step("remove Metallica", () -> bands.delete("Metallica"));
      }
      return status;
    } finally {
      subscription.dispose();
      bands.dispose();
    }
  }

  private static Status step(String description, Supplier<? extends StatusOr<?>> operation) {
    StatusOr<?> result = operation.get();
    if (result.isNotOk()) {
      Logger.error("Failed to {}: {}", description, result.getStatus());
      return result.getStatus();
    }
    Logger.debug("{}: {}", description, result.getValue());
    return Status.ok();
  }

  private static void exitOnError(Status status) {
    if (status.isError()) {
      Logger.error("Demo failed: {}", status);
      System.exit(1);
    }
  }
}
