package de.codesourcery.bcasm.assembler;

import java.util.Collections;
import java.util.List;

import de.codesourcery.bcasm.assembler.exceptions.MalformedLineException;
import de.codesourcery.bcasm.assembler.exceptions.UnresolvedSymbolException;
import de.codesourcery.bcasm.isa.InstructionClass;
import de.codesourcery.bcasm.isa.InstructionSet;
import de.codesourcery.bcasm.isa.InstructionTable;
import de.codesourcery.bcasm.isa.InstructionTableLoader;
import de.codesourcery.bcasm.source.LineTokenizer;
import de.codesourcery.bcasm.source.SourceLine;
import de.codesourcery.bcasm.utils.BitWord;
import junit.framework.TestCase;

public class SecondPassTest extends TestCase {

	private InstructionSet instructionSet;
	private AssemblerOptions options;

	@Override
	protected void setUp() throws Exception
	{
		instructionSet = new InstructionTableLoader().loadDefaults();
		options = new AssemblerOptions();
	}

	private BinaryImage encode(String source)
	{
		final List<SourceLine> lines = new LineTokenizer().tokenize( source );
		final FirstPassResult firstPass = new FirstPass( options ).scan( lines );
		return new SecondPass( instructionSet , options ).encode( lines , firstPass );
	}

	public void testRegisterAndIOInstructionsAreSubstituted()
	{
		final BinaryImage image = encode( "CLA\nINP\nHLT\nEND" );
		assertEquals( "0111100000000000" , image.get( 0 ).asString() );
		assertEquals( "1111100000000000" , image.get( 1 ).asString() );
		assertEquals( "0111000000000001" , image.get( 2 ).asString() );
		assertTrue( image.isFullyResolved() );
	}

	public void testLabeledRegisterInstructionIsSubstituted()
	{
		final BinaryImage image = encode( "START, CMA\nBUN START\nEND" );
		assertEquals( "0111001000000000" , image.get( 0 ).asString() );
		assertEquals( "0100000000000000" , image.get( 1 ).asString() );
	}

	public void testDirectMemoryReference()
	{
		final BinaryImage image = encode( "ORG 5\nX, HEX 0\nORG 0\nLDA X\nEND" );
		assertEquals( "0010000000000101" , image.get( 0 ).asString() );
	}

	public void testIndirectMemoryReference()
	{
		final BinaryImage image = encode( "ORG 5\nX, HEX 0\nORG 0\nLDAI X\nEND" );
		assertEquals( "1010000000000101" , image.get( 0 ).asString() );
	}

	public void testForwardReference()
	{
		final BinaryImage image = encode( "BUN L\nCLA\nL, HEX 0\nEND" );
		assertEquals( "0100000000000010" , image.get( 0 ).asString() );
	}

	public void testBackwardReference()
	{
		final BinaryImage image = encode( "ORG 200\nL, CLA\nISZ L\nBSAI L\nEND" );
		assertEquals( "0110001000000000" , image.get( 0x201 ).asString() );
		assertEquals( "1101001000000000" , image.get( 0x202 ).asString() );
	}

	public void testMemoryReferenceAfterLabelStaysRaw()
	{
		final BinaryImage image = encode( "ORG 10\nX, LDA Y\nY, HEX 1\nEND" );
		assertEquals( CellValue.raw( "lda" ) , image.get( 0x10 ) );
		assertEquals( "0000000000000001" , image.get( 0x11 ).asString() );
		assertEquals( 1 , image.getUnresolvedLocations().size() );
		assertEquals( Integer.valueOf( 0x10 ) , image.getUnresolvedLocations().get(0) );
		assertFalse( image.isFullyResolved() );
	}

	public void testDecimalDirectivePassesThrough()
	{
		final BinaryImage image = encode( "DEC 5\nN, DEC 7\nCLA\nEND" );
		assertEquals( CellValue.raw( "dec" ) , image.get( 0 ) );
		assertEquals( CellValue.raw( "dec" ) , image.get( 1 ) );
		assertEquals( "0111100000000000" , image.get( 2 ).asString() );
	}

	public void testHexLiteralIgnoresTables()
	{
		instructionSet = InstructionSet.empty();
		final BinaryImage image = encode( "V, HEX 53\nEND" );
		assertEquals( "0000000001010011" , image.get( 0 ).asString() );
	}

	public void testUnknownLabel()
	{
		try {
			encode( "CLA\nLDA NOWHERE\nEND" );
			fail("Should've failed");
		} catch(UnresolvedSymbolException e) {
			assertEquals( UnresolvedSymbolException.Kind.LABEL , e.kind );
			assertEquals( "nowhere" , e.getToken() );
			assertEquals( 2 , e.getLineNumber() );
		}
	}

	public void testLabelDefinedAfterEndIsUnknown()
	{
		try {
			encode( "LDA X\nEND\nX, HEX 1" );
			fail("Should've failed");
		} catch(UnresolvedSymbolException e) {
			assertEquals( "x" , e.getToken() );
		}
	}

	public void testUnknownMnemonic()
	{
		try {
			encode( "CLA\nFOO\nEND" );
			fail("Should've failed");
		} catch(UnresolvedSymbolException e) {
			assertEquals( UnresolvedSymbolException.Kind.MNEMONIC , e.kind );
			assertEquals( "foo" , e.getToken() );
			assertEquals( 2 , e.getLineNumber() );
		}
	}

	public void testUnknownMnemonicAfterLabel()
	{
		try {
			encode( "X, BAR\nEND" );
			fail("Should've failed");
		} catch(UnresolvedSymbolException e) {
			assertEquals( "bar" , e.getToken() );
		}
	}

	public void testMemoryReferenceWithoutOperand()
	{
		try {
			encode( "LDA\nEND" );
			fail("Should've failed");
		} catch(MalformedLineException e) {
			assertEquals( 1 , e.getLineNumber() );
		}
	}

	public void testLinesAfterEndAreIgnored()
	{
		final BinaryImage image = encode( "CLA\nEND\nFOO" );
		assertEquals( 1 , image.size() );
	}

	public void testCustomIndirectMarker()
	{
		options.setIndirectMarker( "*" );
		final BinaryImage image = encode( "ORG 5\nX, HEX 0\nORG 0\nLDA* X\nEND" );
		assertEquals( "1010000000000101" , image.get( 0 ).asString() );
	}

	public void testRegisterMnemonicEndingInIndirectMarkerIsNotMemoryReference()
	{
		instructionSet = InstructionSet.empty()
				.withTable( new InstructionTable( InstructionClass.MEMORY_REFERENCE , Collections.singletonMap( "and" , BitWord.parse( "000" ) ) ) )
				.withTable( new InstructionTable( InstructionClass.REGISTER_REFERENCE , Collections.singletonMap( "andi" , BitWord.parse( "0111000000000011" ) ) ) );

		final BinaryImage image = encode( "ANDI X\nX, HEX 1\nEND" );
		assertEquals( "0111000000000011" , image.get( 0 ).asString() );
		assertEquals( "0000000000000001" , image.get( 1 ).asString() );
	}

	public void testFirstPassResultIsNotModified()
	{
		final List<SourceLine> lines = new LineTokenizer().tokenize( "CLA\nLDA X\nX, HEX 1\nEND" );
		final FirstPassResult firstPass = new FirstPass( options ).scan( lines );
		new SecondPass( instructionSet , options ).encode( lines , firstPass );

		assertEquals( CellValue.raw( "cla" ) , firstPass.getSymbolTable().get( 0 ) );
		assertEquals( CellValue.raw( "lda" ) , firstPass.getSymbolTable().get( 1 ) );
	}
}
