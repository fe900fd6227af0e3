package de.codesourcery.bcasm.assembler;

import java.util.List;

import de.codesourcery.bcasm.assembler.exceptions.AddressOverflowException;
import de.codesourcery.bcasm.assembler.exceptions.DuplicateLabelException;
import de.codesourcery.bcasm.assembler.exceptions.MalformedLineException;
import de.codesourcery.bcasm.assembler.exceptions.MalformedLiteralException;
import de.codesourcery.bcasm.assembler.exceptions.MissingEndDirectiveException;
import de.codesourcery.bcasm.source.LineTokenizer;
import de.codesourcery.bcasm.source.SourceLine;
import de.codesourcery.bcasm.utils.BitWord;
import junit.framework.TestCase;

public class FirstPassTest extends TestCase {

	private AssemblerOptions options;

	@Override
	protected void setUp() throws Exception {
		options = new AssemblerOptions();
	}

	private FirstPassResult scan(String source)
	{
		final List<SourceLine> lines = new LineTokenizer().tokenize( source );
		return new FirstPass( options ).scan( lines );
	}

	public void testLocationsStartAtZero()
	{
		final FirstPassResult result = scan( "CLA\nCLE\nX, HEX 7\nEND" );
		final AddressSymbolTable table = result.getSymbolTable();
		assertEquals( 3 , table.size() );
		assertEquals( CellValue.raw( "cla" ) , table.get( 0 ) );
		assertEquals( CellValue.raw( "cle" ) , table.get( 1 ) );
		assertEquals( CellValue.encoded( BitWord.word( 7 ) ) , table.get( 2 ) );
		assertEquals( Integer.valueOf( 2 ) , result.getLabelTable().getLocation( "x" ) );
	}

	public void testOrgSetsLocationWithoutIncrement()
	{
		final FirstPassResult result = scan( "ORG 100\nCLE\nEND" );
		assertEquals( 1 , result.getSymbolTable().size() );
		assertEquals( CellValue.raw( "cle" ) , result.getSymbolTable().get( 0x100 ) );
	}

	public void testMultipleOrgs()
	{
		final FirstPassResult result = scan( "ORG 10\nCLA\nORG 20\nCLE\nEND" );
		assertEquals( CellValue.raw( "cla" ) , result.getSymbolTable().get( 0x10 ) );
		assertEquals( CellValue.raw( "cle" ) , result.getSymbolTable().get( 0x20 ) );
		assertFalse( result.getSymbolTable().contains( 0x11 ) );
	}

	public void testLabelRecordsFollowingMnemonicUnresolved()
	{
		final FirstPassResult result = scan( "LOOP, LDA X\nX, HEX 0\nEND" );
		assertEquals( CellValue.raw( "lda" ) , result.getSymbolTable().get( 0 ) );
		assertEquals( Integer.valueOf( 0 ) , result.getLabelTable().getLocation( "loop" ) );
		assertEquals( Integer.valueOf( 1 ) , result.getLabelTable().getLocation( "x" ) );
	}

	public void testHexLiteralIsEncodedAsSixteenBitWord()
	{
		final FirstPassResult result = scan( "V, HEX FFE9\nEND" );
		assertEquals( "1111111111101001" , result.getSymbolTable().get( 0 ).asString() );
		assertTrue( result.getSymbolTable().get( 0 ).isResolved() );
	}

	public void testEndStopsScanning()
	{
		final FirstPassResult result = scan( "CLA\nEND\nCLE\nY, HEX 1" );
		assertEquals( 1 , result.getSymbolTable().size() );
		assertFalse( result.getLabelTable().isDefined( "y" ) );
		assertTrue( result.isEndSeen() );
		assertEquals( 2 , result.getEndLine().getLineNumber() );
	}

	public void testEmptyAndCommentLinesAreSkipped()
	{
		final FirstPassResult result = scan( "/ header\n\nCLA / clear\n   \nCLE\nEND" );
		assertEquals( CellValue.raw( "cla" ) , result.getSymbolTable().get( 0 ) );
		assertEquals( CellValue.raw( "cle" ) , result.getSymbolTable().get( 1 ) );
	}

	public void testDecimalDirectiveIsStoredVerbatim()
	{
		final FirstPassResult result = scan( "DEC 5\nN, DEC -3\nEND" );
		assertEquals( CellValue.raw( "dec" ) , result.getSymbolTable().get( 0 ) );
		assertEquals( CellValue.raw( "dec" ) , result.getSymbolTable().get( 1 ) );
	}

	public void testMissingEndFails()
	{
		try {
			scan( "CLA\nCLE" );
			fail("Should've failed");
		} catch(MissingEndDirectiveException e) {
			assertEquals( 2 , e.getLineNumber() );
		}
	}

	public void testMissingEndOnEmptyInput()
	{
		try {
			scan( "" );
			fail("Should've failed");
		} catch(MissingEndDirectiveException e) {
			assertEquals( -1 , e.getLineNumber() );
		}
	}

	public void testMissingEndAcceptedWhenLenient()
	{
		options.setRequireEndDirective( false );
		final FirstPassResult result = scan( "CLA\nCLE" );
		assertFalse( result.isEndSeen() );
		assertEquals( 2 , result.getSymbolTable().size() );
	}

	public void testDuplicateLabelFails()
	{
		try {
			scan( "X, CLA\nX, CLE\nEND" );
			fail("Should've failed");
		} catch(DuplicateLabelException e) {
			assertEquals( 2 , e.getLineNumber() );
			assertEquals( "x" , e.label );
		}
	}

	public void testMalformedHexLiteral()
	{
		try {
			scan( "CLA\nX, HEX ZZ\nEND" );
			fail("Should've failed");
		} catch(MalformedLiteralException e) {
			assertEquals( 2 , e.getLineNumber() );
			assertEquals( "zz" , e.getToken() );
			assertTrue( e.getMessage().contains( "X, HEX ZZ" ) );
		}
	}

	public void testHexLiteralOutOfRange()
	{
		try {
			scan( "X, HEX 10000\nEND" );
			fail("Should've failed");
		} catch(MalformedLiteralException e) {
			assertEquals( "10000" , e.getToken() );
		}
	}

	public void testHexWithoutValue()
	{
		try {
			scan( "X, HEX\nEND" );
			fail("Should've failed");
		} catch(MalformedLineException e) {
			assertEquals( 1 , e.getLineNumber() );
		}
	}

	public void testLabelWithoutInstruction()
	{
		try {
			scan( "X,\nEND" );
			fail("Should've failed");
		} catch(MalformedLineException e) {
			assertEquals( "x," , e.getToken() );
		}
	}

	public void testMalformedOrigin()
	{
		try {
			scan( "ORG 1G0\nEND" );
			fail("Should've failed");
		} catch(MalformedLiteralException e) {
			assertEquals( "1g0" , e.getToken() );
		}
	}

	public void testOriginOutOfRange()
	{
		try {
			scan( "ORG 1000\nEND" );
			fail("Should've failed");
		} catch(AddressOverflowException e) {
			assertEquals( 0x1000 , e.location );
		}
	}

	public void testLocationDoesNotWrap()
	{
		try {
			scan( "ORG FFF\nCLA\nCLE\nEND" );
			fail("Should've failed");
		} catch(AddressOverflowException e) {
			assertEquals( 3 , e.getLineNumber() );
			assertEquals( 0x1000 , e.location );
		}
	}

	public void testLastAddressIsUsable()
	{
		final FirstPassResult result = scan( "ORG FFF\nCLA\nEND" );
		assertEquals( CellValue.raw( "cla" ) , result.getSymbolTable().get( 0xfff ) );
	}

	public void testResultIsReadOnly()
	{
		final FirstPassResult result = scan( "CLA\nEND" );
		try {
			result.getSymbolTable().put( 1 , CellValue.raw( "cle" ) );
			fail("Should've failed");
		} catch(UnsupportedOperationException e) {
			// ok
		}
	}
}
