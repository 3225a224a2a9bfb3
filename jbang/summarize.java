///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//REPOS central=https://repo1.maven.org/maven2/
//REPOS central-snapshots=https://central.sonatype.com/repository/maven-snapshots/
//DEPS org.springaicommunity:github-activity-cli:1.0.0-SNAPSHOT

import org.springaicommunity.github.activity.cli.GitHubActivityCli;

public class summarize {
    public static void main(String[] args) {
        GitHubActivityCli.main(args);
    }
}
