package ou.capstone.fakelocation.exceptions;

public class PreferencesException extends Exception
{
    public PreferencesException( final Exception e )
    {
        super( e );
    }

    public PreferencesException( final String msg )
    {
        super( msg );
    }

    public PreferencesException( final String msg, final Exception e )
    {
        super( msg, e );
    }
}
