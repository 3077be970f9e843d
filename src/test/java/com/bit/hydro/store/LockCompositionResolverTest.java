package com.bit.hydro.store;

import com.bit.hydro.common.Fraction;
import com.bit.hydro.database.memory.MemoryDb;
import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.structure.lock.LockComposition;
import com.bit.hydro.structure.lock.LockSuccessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LockCompositionResolverTest {

    private final LockCompositionResolver resolver = new LockCompositionResolver();
    private MemoryDb db;

    @BeforeEach
    void setUp() {
        db = new MemoryDb();
    }

    @Test
    void lockWithoutSuccessorsIsItsOwnLeaf() {
        assertEquals(List.of(new LockComposition(3L, Fraction.ONE)), resolver.getCurrentLockComposition(db, 3));
        assertEquals(0, resolver.depth(db, 3));
    }

    @Test
    void fractionsAccumulateAcrossSplitAndMerge() {
        // 0 拆成 1(2/3)、2(1/3)；1 拆成 3、4 各一半；2 和 3 合并成 5
        resolver.recordSuccessors(db, 0, List.of(new LockSuccessor(1, Fraction.of(2, 3)),
                new LockSuccessor(2, Fraction.of(1, 3))));
        resolver.recordSuccessors(db, 1, List.of(new LockSuccessor(3, Fraction.of(1, 2)),
                new LockSuccessor(4, Fraction.of(1, 2))));
        resolver.recordSuccessors(db, 2, List.of(new LockSuccessor(5, Fraction.ONE)));
        resolver.recordSuccessors(db, 3, List.of(new LockSuccessor(5, Fraction.ONE)));

        List<LockComposition> composition = resolver.getCurrentLockComposition(db, 0);
        assertEquals(List.of(new LockComposition(4L, Fraction.of(1, 3)), new LockComposition(5L, Fraction.of(2, 3))),
                composition);
        Fraction total = composition.stream().map(LockComposition::getFraction).reduce(Fraction.ZERO, Fraction::add);
        assertEquals(Fraction.ONE, total);

        assertEquals(List.of(2L, 3L), resolver.parents(db, 5));
        assertEquals(3, resolver.depth(db, 5));
        assertEquals(2, resolver.depth(db, 4));
    }

    @Test
    void parentCanOnlyBeRetiredOnce() {
        resolver.recordSuccessors(db, 0, List.of(new LockSuccessor(1, Fraction.ONE)));
        HydroException e = assertThrows(HydroException.class, () ->
                resolver.recordSuccessors(db, 0, List.of(new LockSuccessor(2, Fraction.ONE))));
        assertEquals(ErrorType.LINEAGE_CORRUPTED, e.getErrorType());
    }

    @Test
    void cycleIsReportedAsCorruption() {
        resolver.recordSuccessors(db, 0, List.of(new LockSuccessor(1, Fraction.ONE)));
        resolver.recordSuccessors(db, 1, List.of(new LockSuccessor(0, Fraction.ONE)));

        HydroException walk = assertThrows(HydroException.class, () -> resolver.getCurrentLockComposition(db, 0));
        assertEquals(ErrorType.LINEAGE_CORRUPTED, walk.getErrorType());
        HydroException depth = assertThrows(HydroException.class, () -> resolver.depth(db, 1));
        assertEquals(ErrorType.LINEAGE_CORRUPTED, depth.getErrorType());
    }
}
