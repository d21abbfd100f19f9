package io.github.cryptoinspector.cli.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dagger.Module;
import dagger.Provides;
import io.github.cryptoinspector.cli.output.ResultPrinter;
import javax.inject.Singleton;

/**
 * Dagger module providing CLI dependencies.
 */
@Module
public class CliModule {

  /**
   * Provide the writer used for --json output.
   *
   * @param objectMapper the object mapper
   * @return the object writer
   */
  @Provides
  @Singleton
  public ObjectWriter objectWriter(final ObjectMapper objectMapper) {
    return objectMapper.writerWithDefaultPrettyPrinter();
  }

  /**
   * Provide result printer.
   *
   * @param objectWriter the object writer
   * @return the result printer
   */
  @Provides
  @Singleton
  public ResultPrinter resultPrinter(final ObjectWriter objectWriter) {
    return new ResultPrinter(objectWriter);
  }
}
