package com.quick.guessing.game;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GuessServiceTest {

    private NumberSource numbers;
    private ServerContext context;
    private GuessService service;

    @BeforeEach
    void setUp() {
        numbers = mock(NumberSource.class);
        when(numbers.draw(anyInt())).thenReturn(50);
        context = new ServerContext(numbers, 300, 100, 1000);
        service = new GuessService(context);
    }

    @Nested
    class Hosting {

        @Test
        void hostUsesTheHostNameAsGameName() {
            GameEntity game = service.host("HostPlayer").orElseThrow();

            assertThat(game.info().host()).isEqualTo("HostPlayer");
            assertThat(game.info().name()).isEqualTo("HostPlayer");
            assertThat(service.players()).containsExactly("HostPlayer");
            assertThat(service.game("HostPlayer").orElseThrow().host()).isEqualTo("HostPlayer");
        }

        @Test
        void hostCanNameTheGame() {
            GameEntity game = service.host("CoolPlayer", "CoolGame").orElseThrow();

            assertThat(game.info().host()).isEqualTo("CoolPlayer");
            assertThat(game.info().name()).isEqualTo("CoolGame");
        }

        @Test
        void playerCannotHostWhileInAGame() {
            service.host("H");
            service.join("P");

            assertThat(service.host("H").error()).isEqualTo(GameError.PLAYER_IN_GAME);
            assertThat(service.host("P").error()).isEqualTo(GameError.PLAYER_IN_GAME);
        }
    }

    @Nested
    class Joining {

        @Test
        void joinsTheLatestGame() {
            service.host("H1");
            service.host("H2");

            assertThat(service.join("NewPlayer").isOk()).isTrue();

            assertThat(service.game("H1").orElseThrow().players()).containsExactly("H1");
            assertThat(service.game("H2").orElseThrow().players()).containsExactly("H2", "NewPlayer");
        }

        @Test
        void joinsTheGameOfANamedPlayer() {
            service.host("H1");
            service.host("H2");

            assertThat(service.join("NewPlayer", "H1").isOk()).isTrue();

            assertThat(service.game("H1").orElseThrow().players()).containsExactly("H1", "NewPlayer");
            assertThat(service.game("NewPlayer").orElseThrow().host()).isEqualTo("H1");
        }

        @Test
        void joinFailsWithoutATarget() {
            assertThat(service.join("P").error()).isEqualTo(GameError.GAME_NOT_FOUND);
            assertThat(service.join("P", "Ghost").error()).isEqualTo(GameError.PLAYER_NOT_FOUND);

            service.connect("Lonely");
            assertThat(service.join("P", "Lonely").error()).isEqualTo(GameError.GAME_NOT_FOUND);
        }

        @Test
        void joinTwiceOrAcrossGamesIsRejected() {
            service.host("H1");
            service.join("P", "H1");
            service.host("H2");

            assertThat(service.join("P", "H1").error()).isEqualTo(GameError.PLAYER_IN_GAME);
            assertThat(service.join("P", "H2").error()).isEqualTo(GameError.PLAYER_IN_GAME);
            assertThat(service.game("P").orElseThrow().host()).isEqualTo("H1");
        }

        @Test
        void joinAfterStartIsRejected() {
            service.host("H");
            service.start("H");

            assertThat(service.join("Late").error()).isEqualTo(GameError.INVALID_ACTION_FOR_STATE);
            assertThat(service.game("Late").error()).isEqualTo(GameError.GAME_NOT_FOUND);
        }
    }

    @Nested
    class Starting {

        @Test
        void hostStartsTheGame() {
            service.host("Host");
            service.join("Player");

            assertThat(service.start("Host").orElseThrow()).isEqualTo(TurnOutcome.nextTurn(0, 0, "Host"));
            assertThat(service.game("Host").orElseThrow().state()).isEqualTo(GameState.IN_PLAY);
        }

        @Test
        void onlyTheHostCanStart() {
            service.host("Host");
            service.join("Player");

            assertThat(service.start("Player").error()).isEqualTo(GameError.PLAYER_NOT_HOST);
        }

        @Test
        void verbsNeedAConnectedPlayerWithAGame() {
            assertThat(service.start("Ghost").error()).isEqualTo(GameError.PLAYER_NOT_FOUND);
            assertThat(service.play("Ghost", 5).error()).isEqualTo(GameError.PLAYER_NOT_FOUND);
            assertThat(service.restart("Ghost").error()).isEqualTo(GameError.PLAYER_NOT_FOUND);
            assertThat(service.configure("Ghost", GameOptions.maxPoints(10)).error()).isEqualTo(GameError.PLAYER_NOT_FOUND);

            service.connect("Idle");
            assertThat(service.start("Idle").error()).isEqualTo(GameError.GAME_NOT_FOUND);
            assertThat(service.play("Idle", 5).error()).isEqualTo(GameError.GAME_NOT_FOUND);
            assertThat(service.leave("Idle").error()).isEqualTo(GameError.GAME_NOT_FOUND);
        }

        @Test
        void onlyTheHostCanConfigure() {
            service.host("H");
            service.join("P");

            assertThat(service.configure("P", GameOptions.maxPoints(10)).error()).isEqualTo(GameError.PLAYER_NOT_HOST);
            assertThat(service.configure("H", GameOptions.maxPoints(10)).isOk()).isTrue();
            assertThat(service.game("P").orElseThrow().config().maxPoints()).isEqualTo(10);
        }
    }

    @Nested
    class Scoring {

        @Test
        @DisplayName("Assigned 47, guess 74: reverse-match bonus, 98 points")
        void reverseMatchFixture() {
            when(numbers.draw(anyInt())).thenReturn(47, 50);
            service.host("H");
            service.start("H");

            TurnOutcome outcome = service.play("H", 74).orElseThrow();

            assertThat(outcome.kind()).isEqualTo(TurnOutcome.Kind.NEXT_ROUND);
            assertThat(outcome.totals()).containsExactly(entry("H", 98));
            Round played = service.player("H").orElseThrow().rounds().get(1);
            assertThat(played.assigned()).isEqualTo(47);
            assertThat(played.guess()).isEqualTo(74);
            assertThat(played.bonuses()).containsExactly(new Bonus(25, BonusReason.reverseMatch()));
            assertThat(played.points()).isEqualTo(98);
        }

        @Test
        void guessingAnotherPlayersNumberNamesThem() {
            when(numbers.draw(anyInt())).thenReturn(10, 99, 1);
            service.host("H");
            service.join("P");
            service.start("H");

            assertThat(service.play("H", 50).orElseThrow()).isEqualTo(TurnOutcome.nextTurn(0, 1, "P"));
            TurnOutcome outcome = service.play("P", 10).orElseThrow();

            assertThat(outcome.kind()).isEqualTo(TurnOutcome.Kind.NEXT_ROUND);
            assertThat(outcome.round()).isEqualTo(1);
            assertThat(outcome.player()).isEqualTo("H");
            assertThat(outcome.totals()).containsExactly(entry("H", 60), entry("P", 36));
            Round played = service.player("P").orElseThrow().rounds().get(1);
            assertThat(played.bonuses()).containsExactly(new Bonus(25, BonusReason.otherMatch("H")));
        }

        @Test
        void pointsAreNotClampedAtZero() {
            when(numbers.draw(anyInt())).thenReturn(1);
            service.host("H");
            service.configure("H", GameOptions.maxGuess(500));
            service.start("H");

            TurnOutcome outcome = service.play("H", 500).orElseThrow();

            assertThat(outcome.totals()).containsEntry("H", -399);
            assertThat(service.player("H").orElseThrow().points()).isEqualTo(-399);
        }

        @Test
        void totalsAlwaysMatchClosedRounds() {
            ServerContext randomContext = new ServerContext(new RandomNumberSource(), 300, 100, 1000);
            GuessService randomService = new GuessService(randomContext);
            randomService.host("H");
            randomService.join("P");
            randomService.configure("H", GameOptions.maxPoints(1_000_000));
            randomService.start("H");

            int[] guesses = {1, 17, 50, 74, 99, 100, 33, 62};
            for (int guess : guesses) {
                String actor = randomService.game("H").orElseThrow().turn() == 0 ? "H" : "P";
                assertThat(randomService.play(actor, guess).isOk()).isTrue();
                for (String name : List.of("H", "P")) {
                    PlayerInfo info = randomService.player(name).orElseThrow();
                    int closed = info.rounds().stream().filter(Round::isClosed).mapToInt(Round::points).sum();
                    assertThat(info.points()).isEqualTo(closed);
                }
            }
            assertThat(randomService.game("H").orElseThrow().round()).isEqualTo(guesses.length / 2);
        }
    }

    @Nested
    class Ending {

        @BeforeEach
        void playToTheEnd() {
            when(numbers.draw(anyInt())).thenReturn(40, 60, 1);
            service.host("H");
            service.join("P");
            service.configure("H", GameOptions.maxPoints(50));
            service.start("H");
            service.play("H", 45);
        }

        @Test
        void gameEndsOnceATotalReachesMaxPoints() {
            TurnOutcome outcome = service.play("P", 60).orElseThrow();

            assertThat(outcome.kind()).isEqualTo(TurnOutcome.Kind.ENDED);
            assertThat(outcome.totals()).containsExactly(entry("H", 95), entry("P", 150));
            assertThat(service.game("H").orElseThrow().state()).isEqualTo(GameState.ENDED);
            assertThat(service.play("H", 10).error()).isEqualTo(GameError.INVALID_ACTION_FOR_STATE);
            assertThat(service.play("P", 10).error()).isEqualTo(GameError.INVALID_ACTION_FOR_STATE);
        }

        @Test
        void restartClearsEveryLedger() {
            service.play("P", 60);

            assertThat(service.restart("P").error()).isEqualTo(GameError.PLAYER_NOT_HOST);
            assertThat(service.restart("H").orElseThrow()).isEqualTo(TurnOutcome.nextTurn(0, 0, "H"));

            for (String name : List.of("H", "P")) {
                PlayerInfo info = service.player(name).orElseThrow();
                assertThat(info.points()).isZero();
                assertThat(info.rounds()).hasSize(1);
                assertThat(info.rounds().get(0).round()).isZero();
                assertThat(info.rounds().get(0).guess()).isNull();
            }
            GameInfo game = service.game("H").orElseThrow();
            assertThat(game.state()).isEqualTo(GameState.IN_PLAY);
            assertThat(game.round()).isZero();
            assertThat(game.turn()).isZero();
            assertThat(game.config().maxPoints()).isEqualTo(50);
        }
    }

    @Nested
    class Server {

        @Test
        void namesAreUniqueWhileConnected() {
            assertThat(service.connect("alice").isOk()).isTrue();
            assertThat(service.connect("alice").error()).isEqualTo(GameError.PLAYER_NAME_TAKEN);

            assertThat(service.disconnect("alice").isOk()).isTrue();
            assertThat(service.connect("alice").isOk()).isTrue();
        }

        @Test
        void hostingConnectsThePlayer() {
            service.host("H");

            assertThat(service.connect("H").error()).isEqualTo(GameError.PLAYER_NAME_TAKEN);
            assertThat(service.disconnect("nobody").error()).isEqualTo(GameError.PLAYER_NOT_FOUND);
        }

        @Test
        void disconnectLeavesTheGame() {
            service.host("H");
            service.join("P");

            assertThat(service.disconnect("P").isOk()).isTrue();

            assertThat(service.game("H").orElseThrow().players()).containsExactly("H");
            assertThat(service.players()).containsExactly("H");
        }

        @Test
        void playersCannotLeaveMidGame() {
            service.host("H");
            service.join("P");
            service.start("H");

            assertThat(service.leave("P").error()).isEqualTo(GameError.INVALID_ACTION_FOR_STATE);
            assertThat(service.disconnect("P").error()).isEqualTo(GameError.INVALID_ACTION_FOR_STATE);
            assertThat(service.players()).contains("P");
        }

        @Test
        void hostLeavingEndsTheGame() {
            GameEntity game = service.host("H").orElseThrow();
            service.join("P");

            assertThat(service.leave("H").isOk()).isTrue();

            assertThat(service.games()).isEmpty();
            assertThat(service.game("P").error()).isEqualTo(GameError.GAME_NOT_FOUND);
            assertThatThrownBy(game::info).isInstanceOf(EntityUnavailableException.class);
            assertThat(service.host("P").isOk()).isTrue();
        }

        @Test
        void onlyTheHostEndsTheGame() {
            service.host("H");
            service.join("P");

            assertThat(service.endGame("P").error()).isEqualTo(GameError.PLAYER_NOT_HOST);
            assertThat(service.endGame("H").isOk()).isTrue();
            assertThat(service.game("H").error()).isEqualTo(GameError.GAME_NOT_FOUND);
            assertThat(service.players()).containsExactlyInAnyOrder("H", "P");
        }

        @Test
        void infoListsPlayersAndGames() {
            service.host("H", "Friday");
            service.join("P");
            service.connect("Idle");

            ServerInfo info = service.info();

            assertThat(info.players()).containsExactlyInAnyOrder("H", "P", "Idle");
            assertThat(info.games()).containsExactly("H's game: Setting up");
        }

        @Test
        void blankNamesAreRejected() {
            assertThat(service.connect(null).error()).isEqualTo(GameError.PLAYER_NOT_FOUND);
            assertThat(service.connect(" ").error()).isEqualTo(GameError.PLAYER_NOT_FOUND);
            assertThat(service.host("").error()).isEqualTo(GameError.PLAYER_NOT_FOUND);
            assertThat(service.join(null).error()).isEqualTo(GameError.PLAYER_NOT_FOUND);
            assertThat(service.players()).isEmpty();
        }

        @Test
        void endedGameFreesItsHostName() {
            GameEntity first = service.host("H").orElseThrow();
            service.endGame("H");
            GameEntity second = service.host("H").orElseThrow();

            assertThat(first.isAlive()).isFalse();
            assertThat(second.isAlive()).isTrue();
            assertThat(service.game("H").orElseThrow().players()).containsExactly("H");
        }

        @Test
        void resetIsIdempotent() {
            service.host("H");
            service.join("P");

            assertThat(service.reset().isOk()).isTrue();
            assertThat(service.reset().isOk()).isTrue();

            assertThat(service.players()).isEmpty();
            assertThat(service.games()).isEmpty();
            assertThat(context.getGames().list()).isEmpty();
        }
    }

    @Nested
    class Concurrency {

        @Test
        void concurrentJoinsAllLand() throws Exception {
            service.host("H");
            List<String> names = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                names.add("player-" + i);
            }

            List<Result<Void>> results = runConcurrently(names.stream()
                    .<Callable<Result<Void>>>map(name -> () -> service.join(name))
                    .toList());

            assertThat(results).allMatch(Result::isOk);
            List<String> roster = service.game("H").orElseThrow().players();
            assertThat(roster).hasSize(21).doesNotHaveDuplicates().startsWith("H");
        }

        @Test
        void aTurnIsPlayedExactlyOnce() throws Exception {
            service.host("H");
            service.join("P");
            service.start("H");

            List<Callable<Result<TurnOutcome>>> plays = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                plays.add(() -> service.play("H", 42));
            }
            List<Result<TurnOutcome>> results = runConcurrently(plays);

            assertThat(results).filteredOn(Result::isOk).hasSize(1);
            assertThat(results).filteredOn(r -> r.isError(GameError.WRONG_TURN)).hasSize(7);
            assertThat(service.player("H").orElseThrow().points()).isEqualTo(92);
        }

        @RepeatedTest(50)
        void hostingAndJoiningRaceLeavesThePlayerInOneGame() throws Exception {
            service.host("Y");

            List<Result<?>> results = runConcurrently(List.<Callable<Result<?>>>of(
                    () -> service.host("X"),
                    () -> service.join("X", "Y")));

            boolean hosted = results.get(0).isOk();
            boolean joined = results.get(1).isOk();
            assertThat(hosted && joined).isFalse();
            assertThat(hosted || joined).isTrue();

            List<String> rosterOfY = service.game("Y").orElseThrow().players();
            GameInfo gameOfX = service.game("X").orElseThrow();
            if (hosted) {
                assertThat(rosterOfY).containsExactly("Y");
                assertThat(gameOfX.host()).isEqualTo("X");
            } else {
                assertThat(rosterOfY).containsExactly("Y", "X");
                assertThat(gameOfX.host()).isEqualTo("Y");
                assertThat(context.getGames().contains("X")).isFalse();
            }
        }

        @RepeatedTest(20)
        void endingAGameWhilePlayersJoinLeavesNobodyBehind() throws Exception {
            service.host("H");
            List<Callable<String>> tasks = new ArrayList<>();
            tasks.add(() -> service.endGame("H").isOk() ? "ended" : "not-ended");
            for (int i = 0; i < 8; i++) {
                String name = "late-" + i;
                tasks.add(() -> {
                    try {
                        return service.join(name, "H").isOk() ? "joined" : "rejected";
                    } catch (EntityUnavailableException e) {
                        return "unavailable";
                    }
                });
            }

            List<String> results = runConcurrently(tasks);

            assertThat(results.get(0)).isEqualTo("ended");
            assertThat(service.games()).isEmpty();
            for (int i = 0; i < 8; i++) {
                String name = "late-" + i;
                assertThat(service.game(name).isOk()).isFalse();
                assertThat(service.host(name).isOk()).isTrue();
            }
        }

        private <T> List<T> runConcurrently(List<Callable<T>> tasks) throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
            CountDownLatch go = new CountDownLatch(1);
            try {
                List<Future<T>> futures = new ArrayList<>();
                for (Callable<T> task : tasks) {
                    futures.add(pool.submit(() -> {
                        go.await();
                        return task.call();
                    }));
                }
                go.countDown();
                List<T> results = new ArrayList<>();
                for (Future<T> future : futures) {
                    results.add(future.get(10, TimeUnit.SECONDS));
                }
                return results;
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
