package com.github.alvarosanchez.spr;

import com.github.alvarosanchez.spr.command.SprCommand;
import io.micronaut.configuration.picocli.MicronautFactory;
import io.micronaut.context.ApplicationContext;
import picocli.CommandLine;

public final class Application {

    private Application() {
    }

    public static void main(String[] args) {
        int exitCode;
        try (ApplicationContext context = ApplicationContext.builder().start()) {
            exitCode = new CommandLine(context.getBean(SprCommand.class), new MicronautFactory(context))
                .setUsageHelpAutoWidth(true)
                .execute(args);
        }
        System.exit(exitCode);
    }
}
