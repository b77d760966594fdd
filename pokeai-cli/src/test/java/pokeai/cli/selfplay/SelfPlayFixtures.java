package pokeai.cli.selfplay;

import pokeai.cli.TestFiles;
import pokeai.engine.BattleEngine;
import pokeai.io.TeamLoader;

import java.io.IOException;
import java.io.UncheckedIOException;

final class SelfPlayFixtures {

    private SelfPlayFixtures() {
    }

    /** offense vs balance in gen9ou. */
    static Matchup matchup(BattleEngine engine) {
        try {
            return new Matchup(engine, engine.format("gen9ou"),
                    TeamLoader.read(TestFiles.team("offense.json").toPath()),
                    TeamLoader.read(TestFiles.team("balance.json").toPath()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
