package com.secondhand.error;

import org.junit.Test;

import static org.junit.Assert.*;

public class OperationResultTest {

    @Test
    public void testSuccess() {
        OperationResult<String> result = OperationResult.success("ok");

        assertTrue(result.isSuccess());
        assertEquals("ok", result.getValue());
        assertNull(result.getError());
        assertFalse(result.failedWith(ErrorKind.VALIDATION));
    }

    @Test(expected = IllegalStateException.class)
    public void testGetValue_Failure_Throws() {
        OperationResult.race("already sold").getValue();
    }

    @Test
    public void testAsFailure_KeepsError() {
        OperationResult<String> failed = OperationResult.funds("broke");

        OperationResult<Integer> retyped = failed.asFailure();

        assertTrue(retyped.failedWith(ErrorKind.FUNDS));
        assertEquals("broke", retyped.getError().getMessage());
    }

    @Test
    public void testMap() {
        assertEquals(Integer.valueOf(2), OperationResult.success("ab").map(String::length).getValue());
        assertTrue(OperationResult.<String>validation("no").map(String::length).failedWith(ErrorKind.VALIDATION));
    }

    @Test(expected = IllegalStateException.class)
    public void testAsFailure_OnSuccess_Throws() {
        OperationResult.success("ok").asFailure();
    }
}
