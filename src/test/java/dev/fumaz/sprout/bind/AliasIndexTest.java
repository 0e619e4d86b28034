package dev.fumaz.sprout.bind;

import dev.fumaz.sprout.exception.AliasAlreadyDefinedException;
import dev.fumaz.sprout.exception.AmbiguousAliasException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AliasIndexTest {

    @Test
    void infersEveryNameVariant() {
        AliasIndex aliases = new AliasIndex();
        aliases.infer(CatsRepository.class);

        assertSame(CatsRepository.class, aliases.lookup("CatsRepository", Object.class));
        assertSame(CatsRepository.class, aliases.lookup("cats_repository", Object.class));
        assertSame(CatsRepository.class, aliases.lookup("catsRepository", Object.class));
        assertSame(CatsRepository.class, aliases.lookup("catsrepository", Object.class));
        assertNull(aliases.lookup("dogs", Object.class));
    }

    @Test
    void exactAliasesTakePrecedenceOverInferredOnes() {
        AliasIndex aliases = new AliasIndex();
        aliases.infer(First.Service.class);
        aliases.infer(Second.Service.class);

        assertThrows(AmbiguousAliasException.class, () -> aliases.lookup("service", Object.class));

        aliases.setAlias("service", Second.Service.class, false);

        assertSame(Second.Service.class, aliases.lookup("service", Object.class));
    }

    @Test
    void reportsCandidatesOfAmbiguousNames() {
        AliasIndex aliases = new AliasIndex();
        aliases.infer(First.Service.class);
        aliases.infer(Second.Service.class);

        AmbiguousAliasException exception = assertThrows(AmbiguousAliasException.class,
                () -> aliases.lookup("Service", AliasIndexTest.class));

        assertEquals(2, exception.getCandidates().size());
        assertSame(AliasIndexTest.class, exception.getDesiredType());
        assertTrue(exception.getMessage().contains("Service"));
    }

    @Test
    void rejectsAdditionalAliasesForKnownNames() {
        AliasIndex aliases = new AliasIndex();
        aliases.infer(CatsRepository.class);
        aliases.addAlias("repo", CatsRepository.class);

        assertThrows(AliasAlreadyDefinedException.class, () -> aliases.addAlias("cats_repository", First.Service.class));
        assertThrows(AliasAlreadyDefinedException.class, () -> aliases.addAlias("repo", First.Service.class));
    }

    @Test
    void overridesExactAliasesOnlyWhenAsked() {
        AliasIndex aliases = new AliasIndex();
        aliases.setAlias("service", First.Service.class, false);

        assertThrows(AliasAlreadyDefinedException.class,
                () -> aliases.setAlias("service", Second.Service.class, false));

        aliases.setAlias("service", Second.Service.class, true);
        assertSame(Second.Service.class, aliases.getExact().get("service"));
    }

    static class CatsRepository {
    }

    static class First {
        static class Service {
        }
    }

    static class Second {
        static class Service {
        }
    }
}
