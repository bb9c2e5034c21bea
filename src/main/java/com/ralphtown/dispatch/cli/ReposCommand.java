package com.ralphtown.dispatch.cli;

import com.ralphtown.core.model.Repo;
import com.ralphtown.core.repos.RepoService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: ralphtown repos
 */
@Command(name = "repos", mixinStandardHelpOptions = true, description = "List registered repositories")
@Component
public class ReposCommand implements Runnable {

    private final RepoService repoService;

    public ReposCommand(RepoService repoService) {
        this.repoService = repoService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Repo> repos = repoService.list();
        if (repos.isEmpty()) {
            ConsoleOutput.info("No repositories registered.");
            return;
        }

        ConsoleOutput.info("Repositories (" + repos.size() + "):");
        System.out.println();
        System.out.printf("  %-36s %-24s %s%n", "REPO ID", "NAME", "PATH");
        System.out.println("  " + "-".repeat(86));
        for (Repo repo : repos) {
            System.out.printf("  %-36s %-24s %s%n", repo.id(),
                    ConsoleOutput.truncate(repo.name(), 24), repo.path());
        }
    }
}
