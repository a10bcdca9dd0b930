// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.unpyc3;

import static uk.co.farowl.unpyc3.Opcode.*;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The pre-pass that decides which conditional jumps in a unit lead to
 * the else clause of an {@code if} (explicit or empty), as opposed to
 * being the test of a loop or an operand of a short-circuit
 * {@code and}/{@code or}.
 * <p>
 * The scan proceeds forward, remembering the most recent candidate
 * jump. A candidate is a {@code POP_JUMP_IF_*} whose target follows an
 * instruction that ends a block (or is itself a {@code FOR_ITER}). A
 * later candidate to the same target displaces an earlier one, which
 * must then have been an operand of {@code and}/{@code or}. Meeting an
 * instruction that makes a statement confirms the pending candidate,
 * since only an else-branch may contain statements.
 * <p>
 * Candidates are kept in two maps: one keyed by jump target and one
 * keyed by the statement that confirmed them. Keeping them apart means
 * a statement at the target of one jump cannot discard that jump.
 */
final class ElseJumps {

    private static final Logger logger =
            LoggerFactory.getLogger(ElseJumps.class);

    private ElseJumps() {} // no instances

    /** Opcodes that will generate a statement. */
    static final Set<Opcode> STATEMENT_OPCODES = Collections
            .unmodifiableSet(EnumSet.of(SETUP_LOOP, BREAK_LOOP,
                    CONTINUE_LOOP, SETUP_FINALLY, END_FINALLY,
                    SETUP_EXCEPT, POP_EXCEPT, SETUP_WITH, POP_BLOCK,
                    STORE_FAST, DELETE_FAST, STORE_DEREF, DELETE_DEREF,
                    STORE_GLOBAL, DELETE_GLOBAL, STORE_NAME, DELETE_NAME,
                    STORE_ATTR, DELETE_ATTR, STORE_SUBSCR, DELETE_SUBSCR,
                    IMPORT_NAME, IMPORT_FROM, RETURN_VALUE, YIELD_VALUE,
                    RAISE_VARARGS, POP_TOP));

    /**
     * Opcodes that, placed just before the target of a conditional jump,
     * make that jump a candidate else-jump.
     */
    static final Set<Opcode> ELSE_JUMP_PREDECESSORS =
            Collections.unmodifiableSet(EnumSet.of(JUMP_FORWARD,
                    RETURN_VALUE, JUMP_ABSOLUTE, SETUP_LOOP,
                    RAISE_VARARGS));

    /**
     * Find the else-jumps in a unit.
     *
     * @param unit to scan
     * @return addresses of the conditional jumps that are else-jumps
     */
    static Set<Address> find(CompiledUnit unit) {
        Map<Address, Address> byTarget = new HashMap<>();
        Map<Address, Address> byStatement = new HashMap<>();
        Address lastJump = null;

        for (int i = 0; i < unit.size(); i++) {
            Address addr = unit.at(i);
            Opcode opcode = addr.opcode();
            if (opcode == POP_JUMP_IF_FALSE || opcode == POP_JUMP_IF_TRUE) {
                Address target = addr.jump();
                Opcode before = Address.opcodeAt(target.offset(-1));
                if (ELSE_JUMP_PREDECESSORS.contains(before)
                        || target.opcode() == FOR_ITER) {
                    lastJump = addr;
                    byTarget.put(target, addr);
                }
            } else if (opcode == JUMP_ABSOLUTE) {
                // A jump to a shared exit, as when nested ifs end together
                Address target = addr.jump();
                Address j = byTarget.get(target);
                if (j == null) { j = byStatement.get(target); }
                if (j != null) { byTarget.put(addr, j); }
            } else if (lastJump != null
                    && STATEMENT_OPCODES.contains(opcode)) {
                byStatement.put(addr, lastJump);
            }
        }

        Set<Address> result = new HashSet<>(byTarget.values());
        result.addAll(byStatement.values());
        logger.atDebug().setMessage("else-jumps in {}: {}")
                .addArgument(unit::name).addArgument(result.size()).log();
        return Collections.unmodifiableSet(result);
    }
}
